package com.sitecraft.schedule;

import java.util.Locale;

public enum Phase {
    DISCOVERY,
    PARSING,
    RENDERING,
    POST_PROCESSING;

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static Phase fromKey(String key) {
        for (Phase phase : values()) {
            if (phase.key().equals(key) || phase.name().equalsIgnoreCase(key)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown build phase: " + key);
    }
}
