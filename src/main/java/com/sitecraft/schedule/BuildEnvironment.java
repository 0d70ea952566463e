package com.sitecraft.schedule;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Where the build runs. Constrained CI runners get a hard worker cap.
 */
public enum BuildEnvironment {
    CI(2),
    LOCAL(Integer.MAX_VALUE),
    PRODUCTION(Integer.MAX_VALUE);

    public static final String OVERRIDE_VARIABLE = "SITECRAFT_ENV";

    private static final List<String> CI_INDICATORS = List.of(
            "CI",
            "GITHUB_ACTIONS",
            "GITLAB_CI",
            "CIRCLECI",
            "TRAVIS",
            "JENKINS_URL",
            "BUILDKITE",
            "CODEBUILD_BUILD_ID",
            "TF_BUILD");

    private final int workerCap;

    BuildEnvironment(int workerCap) {
        this.workerCap = workerCap;
    }

    public int workerCap() {
        return workerCap;
    }

    /**
     * Resolution order: explicit configuration, then {@value #OVERRIDE_VARIABLE}, then CI variables, then
     * {@link #LOCAL}.
     */
    public static BuildEnvironment detect(String configured, Map<String, String> environment) {
        BuildEnvironment explicit = parse(configured);
        if (explicit != null) {
            return explicit;
        }
        explicit = parse(environment.get(OVERRIDE_VARIABLE));
        if (explicit != null) {
            return explicit;
        }
        for (String indicator : CI_INDICATORS) {
            String value = environment.get(indicator);
            if (value != null && !value.isBlank() && !"false".equalsIgnoreCase(value)) {
                return CI;
            }
        }
        return LOCAL;
    }

    private static BuildEnvironment parse(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown build environment: " + value, e);
        }
    }
}
