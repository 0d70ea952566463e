package com.sitecraft.build;

/**
 * @param artifactId output or source id the failure is recorded against; {@code "<cycle>"} for cycle-fatal errors
 */
public record BuildFailure(String artifactId, FailureCategory category, String message) {
    public static final String CYCLE = "<cycle>";

    public static BuildFailure cycle(FailureCategory category, String message) {
        return new BuildFailure(CYCLE, category, message);
    }
}
