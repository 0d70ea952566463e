package com.sitecraft.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Evaluates aggregate definitions structurally against the current page set. Membership is recomputed in
 * full every cycle rather than diffed.
 */
public class AggregateResolver {
    private final List<AggregateDefinition> definitions;

    public AggregateResolver(List<AggregateDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    /**
     * @param pages page source id to metadata
     * @return aggregate output id to membership, aggregates without members omitted
     */
    public Map<String, AggregateMembership> resolve(Map<String, PageMetadata> pages) {
        Map<String, AggregateMembership> resolved = new LinkedHashMap<>();
        for (AggregateDefinition definition : definitions) {
            if (definition.perValue()) {
                TreeSet<String> values = new TreeSet<>();
                for (PageMetadata page : pages.values()) {
                    if (!page.draft()) {
                        values.addAll(page.values(definition.field()));
                    }
                }
                // values differing only in case or punctuation share a slug and therefore one output
                Map<String, String> bySlug = new LinkedHashMap<>();
                for (String value : values) {
                    bySlug.putIfAbsent(slug(value), value);
                }
                for (Map.Entry<String, String> entry : bySlug.entrySet()) {
                    String outputId = definition.output().replace(AggregateDefinition.VALUE_PLACEHOLDER, entry.getKey());
                    add(resolved, outputId, new AggregatePredicate(definition.field(), entry.getValue(), true), pages);
                }
            } else {
                add(resolved, definition.output(), new AggregatePredicate(definition.field(), definition.value()), pages);
            }
        }
        return resolved;
    }

    private static void add(Map<String, AggregateMembership> resolved, String outputId, AggregatePredicate predicate, Map<String, PageMetadata> pages) {
        List<Map.Entry<String, PageMetadata>> matching = new ArrayList<>();
        for (Map.Entry<String, PageMetadata> entry : pages.entrySet()) {
            if (predicate.matches(entry.getValue())) {
                matching.add(entry);
            }
        }
        if (matching.isEmpty()) {
            return;
        }
        matching.sort(Comparator.<Map.Entry<String, PageMetadata>>comparingInt(entry -> entry.getValue().weight())
                .thenComparing(Map.Entry::getKey));
        List<String> members = matching.stream().map(Map.Entry::getKey).toList();
        resolved.put(outputId, AggregateMembership.of(outputId, predicate, members));
    }

    static String slug(String value) {
        return AggregatePredicate.slug(value);
    }
}
