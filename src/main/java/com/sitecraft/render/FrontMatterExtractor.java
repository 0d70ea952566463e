package com.sitecraft.render;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.sitecraft.graph.PageMetadata;
import com.sitecraft.source.SourceArtifact;

/**
 * Reference {@link MetadataExtractor} reading YAML front matter. Scalar and list values other than the
 * reserved keys become list-valued fields that aggregates can select on.
 */
public class FrontMatterExtractor implements MetadataExtractor {
    private static final Set<String> RESERVED = Set.of("title", "draft", "weight", "layout");

    @Override
    public PageMetadata extract(SourceArtifact source, byte[] content) throws RenderException {
        FrontMatter frontMatter = FrontMatter.parse(new String(content, StandardCharsets.UTF_8));
        Map<String, Object> values = frontMatter.fields();

        Map<String, List<String>> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (RESERVED.contains(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            List<String> list = toList(entry.getValue());
            if (!list.isEmpty()) {
                fields.put(entry.getKey(), list);
            }
        }
        return new PageMetadata(
                title(values.get("title"), source.id()),
                Boolean.parseBoolean(String.valueOf(values.getOrDefault("draft", "false"))),
                weight(values.get("weight"), source.id()),
                values.get("layout") == null ? null : String.valueOf(values.get("layout")),
                fields);
    }

    private static String title(Object value, String sourceId) {
        if (value != null && !String.valueOf(value).isBlank()) {
            return String.valueOf(value);
        }
        String name = sourceId.substring(sourceId.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static int weight(Object value, String sourceId) throws RenderException {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new RenderException("Invalid weight '" + value + "' in " + sourceId, e);
        }
    }

    private static List<String> toList(Object value) {
        List<String> list = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    list.add(String.valueOf(item).trim());
                }
            }
        } else if (!(value instanceof Map<?, ?>)) {
            String scalar = String.valueOf(value).trim();
            if (!scalar.isEmpty()) {
                list.add(scalar);
            }
        }
        return list;
    }
}
