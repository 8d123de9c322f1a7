package com.koni.energy.domain.exception;

/**
 * Exception thrown when required configuration is missing or invalid at startup.
 */
public class ConfigurationException extends RuntimeException {
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
