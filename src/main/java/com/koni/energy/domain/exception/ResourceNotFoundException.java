package com.koni.energy.domain.exception;

/**
 * Exception thrown when a rule, device or event does not exist or belongs to another owner.
 * Both cases are reported the same way so that callers cannot probe other owners' data.
 */
public class ResourceNotFoundException extends RuntimeException {
    
    public ResourceNotFoundException(String message) {
        super(message);
    }
    
    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
