package com.sitecraft.graph;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Front-matter facts about a content page that aggregate predicates are evaluated against.
 * {@code fields} holds list-valued metadata such as {@code tags} or {@code menu}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageMetadata(String title, boolean draft, int weight, String layout, Map<String, List<String>> fields) {

    public PageMetadata {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public List<String> values(String field) {
        return fields.getOrDefault(field, List.of());
    }
}
