package com.koni.energy.domain.exception;

/**
 * Exception thrown when the database is unavailable or fails to execute operations.
 * An evaluation pass that hits this exception is aborted; it is safe to run the pass again.
 */
public class DatabaseUnavailableException extends RuntimeException {
    
    public DatabaseUnavailableException(String message) {
        super(message);
    }
    
    public DatabaseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
