package com.koni.energy.domain.exception;

/**
 * Exception thrown when an owner already has an alert rule with the requested name.
 */
public class DuplicateAlertNameException extends RuntimeException {
    
    public DuplicateAlertNameException(String message) {
        super(message);
    }
    
    public DuplicateAlertNameException(String message, Throwable cause) {
        super(message, cause);
    }
}
