package com.pairninja.config;

/**
 * Raised when configuration is missing, malformed or violates a cross-field rule.
 * Always fatal at startup.
 */
public class ConfigException extends RuntimeException {

    private final String key;

    public ConfigException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ConfigException(String key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
