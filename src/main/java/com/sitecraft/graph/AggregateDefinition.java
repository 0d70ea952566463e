package com.sitecraft.graph;

/**
 * Declared aggregate. When {@code perValue} is set the definition expands into one aggregate per distinct
 * value of {@code field}, and {@code output} must contain a {@code {value}} placeholder.
 */
public record AggregateDefinition(String output, String field, String value, boolean perValue) {
    public static final String VALUE_PLACEHOLDER = "{value}";

    public AggregateDefinition {
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("aggregate output must be set");
        }
        if (perValue && (field == null || !output.contains(VALUE_PLACEHOLDER))) {
            throw new IllegalArgumentException("per-value aggregate " + output + " needs a field and a " + VALUE_PLACEHOLDER + " placeholder");
        }
    }
}
