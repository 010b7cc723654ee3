package com.wifi.threat.exception;

/**
 * Exception thrown when a scan batch is malformed as a whole.
 */
public class InvalidPayloadException extends RuntimeException {

    public InvalidPayloadException(String message) {
        super(message);
    }
}
