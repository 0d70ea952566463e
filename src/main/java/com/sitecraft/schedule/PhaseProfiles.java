package com.sitecraft.schedule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Per-phase profiles. Defaults ship as the {@value #RESOURCE} classpath resource produced by offline
 * calibration; engine configuration may override single phases.
 */
public final class PhaseProfiles {
    public static final String RESOURCE = "/scheduler-profiles.yml";

    private final Map<Phase, PhaseProfile> profiles;

    private PhaseProfiles(Map<Phase, PhaseProfile> profiles) {
        for (Phase phase : Phase.values()) {
            PhaseProfile profile = profiles.get(phase);
            if (profile == null) {
                throw new IllegalArgumentException("Missing scheduler profile for phase " + phase.key());
            }
            profile.validate(phase.key());
        }
        this.profiles = profiles;
    }

    public static PhaseProfiles of(Map<Phase, PhaseProfile> profiles) {
        return new PhaseProfiles(new EnumMap<>(profiles));
    }

    public static PhaseProfiles loadDefaults() {
        try (InputStream in = PhaseProfiles.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Scheduler profile resource " + RESOURCE + " not found");
            }
            ProfileDocument document = new ObjectMapper(new YAMLFactory()).readValue(in, ProfileDocument.class);
            return new PhaseProfiles(toPhaseMap(document.profiles));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
    }

    /**
     * Applies partial overrides keyed by phase key; fields an override leaves unset keep this profile's value.
     */
    public PhaseProfiles withOverrides(Map<String, PhaseProfileOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<Phase, PhaseProfile> merged = new EnumMap<>(profiles);
        overrides.forEach((key, override) -> {
            if (override != null) {
                Phase phase = Phase.fromKey(key);
                merged.put(phase, override.applyTo(profiles.get(phase)));
            }
        });
        return new PhaseProfiles(merged);
    }

    public PhaseProfile get(Phase phase) {
        return profiles.get(phase);
    }

    private static Map<Phase, PhaseProfile> toPhaseMap(Map<String, PhaseProfile> byKey) {
        Map<Phase, PhaseProfile> map = new EnumMap<>(Phase.class);
        if (byKey != null) {
            byKey.forEach((key, profile) -> map.put(Phase.fromKey(key), profile));
        }
        return map;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProfileDocument {
        public Map<String, PhaseProfile> profiles;
    }
}
