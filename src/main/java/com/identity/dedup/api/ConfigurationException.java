package com.identity.dedup.api;

/**
 * Thrown when deduplication settings are invalid.
 * Raised before any identity is scored; the engine raises no other hard failure.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
