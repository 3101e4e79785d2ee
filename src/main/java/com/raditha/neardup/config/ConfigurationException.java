package com.raditha.neardup.config;

/**
 * Invalid or missing configuration. Always raised before any scanning starts.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
