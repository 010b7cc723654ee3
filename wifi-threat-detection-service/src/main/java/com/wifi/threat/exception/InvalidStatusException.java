package com.wifi.threat.exception;

/**
 * Exception thrown when a manual status change names a value outside the valid statuses.
 */
public class InvalidStatusException extends RuntimeException {

    public static final String MESSAGE = "Invalid status. Must be: trusted, unknown, or suspicious";

    private final String rejectedValue;

    public InvalidStatusException(String rejectedValue) {
        super(MESSAGE);
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
