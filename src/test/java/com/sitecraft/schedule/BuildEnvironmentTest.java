package com.sitecraft.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

class BuildEnvironmentTest {

    @Test
    void shouldDetectCiFromIndicatorVariables() {
        assertEquals(BuildEnvironment.CI, BuildEnvironment.detect("auto", Map.of("GITHUB_ACTIONS", "true")));
        assertEquals(BuildEnvironment.LOCAL, BuildEnvironment.detect("auto", Map.of("CI", "false")));
        assertEquals(BuildEnvironment.LOCAL, BuildEnvironment.detect(null, Map.of()));
    }

    @Test
    void shouldPreferConfigurationThenOverrideVariable() {
        Map<String, String> env = Map.of("CI", "1", BuildEnvironment.OVERRIDE_VARIABLE, "production");

        assertEquals(BuildEnvironment.PRODUCTION, BuildEnvironment.detect("auto", env));
        assertEquals(BuildEnvironment.LOCAL, BuildEnvironment.detect("local", env));
    }

    @Test
    void shouldRejectUnknownEnvironment() {
        assertThrows(IllegalArgumentException.class, () -> BuildEnvironment.detect("staging", Map.of()));
    }
}
