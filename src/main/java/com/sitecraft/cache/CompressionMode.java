package com.sitecraft.cache;

import java.util.Locale;

public enum CompressionMode {
    AUTO,
    ALWAYS,
    NEVER;

    public static CompressionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cache compression mode: " + value, e);
        }
    }
}
