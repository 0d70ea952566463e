package com.sitecraft.render;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * YAML block fenced by {@code ---} lines at the top of a content file, followed by the body.
 */
public record FrontMatter(Map<String, Object> fields, String body) {
    private static final String FENCE = "---";
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static FrontMatter parse(String text) throws RenderException {
        String normalized = text.replace("\r\n", "\n");
        if (!normalized.startsWith(FENCE + "\n")) {
            return new FrontMatter(Map.of(), normalized);
        }
        int end = normalized.indexOf("\n" + FENCE, FENCE.length());
        if (end < 0) {
            throw new RenderException("Unterminated front matter");
        }
        String yaml = normalized.substring(FENCE.length() + 1, end + 1);
        int bodyStart = normalized.indexOf('\n', end + 1 + FENCE.length());
        String body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);
        if (yaml.isBlank()) {
            return new FrontMatter(Map.of(), body);
        }
        try {
            Map<String, Object> fields = YAML.readValue(yaml, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return new FrontMatter(fields == null ? Map.of() : fields, body);
        } catch (JsonProcessingException e) {
            throw new RenderException("Invalid front matter: " + e.getOriginalMessage(), e);
        }
    }
}
