package com.wifi.threat.exception;

/**
 * Exception thrown when a record changed between read and write (optimistic lock conflict).
 */
public class ConcurrentUpdateException extends RuntimeException {

    public ConcurrentUpdateException(String message) {
        super(message);
    }

    public ConcurrentUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
