package com.sitecraft.build;

/**
 * Invalid site configuration. Fatal for the cycle because every output would be computed from it.
 */
public class ConfigException extends IllegalArgumentException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
