package com.kotsin.enrichment.settings;

/**
 * The configuration document could not be read, written or validated.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
