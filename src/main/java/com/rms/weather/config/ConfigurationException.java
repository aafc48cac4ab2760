package com.rms.weather.config;

/**
 * Schema or connection misconfiguration detected at startup.
 *
 * Thrown from bean factories and bootstrappers so the Spring context fails to
 * start instead of serving with guarantees it cannot keep.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
