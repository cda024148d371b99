package com.example.hostwatch.config;

/**
 * Raised while the application context starts when configuration cannot be used,
 * e.g. a low-water mark that is not below its high-water mark.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
