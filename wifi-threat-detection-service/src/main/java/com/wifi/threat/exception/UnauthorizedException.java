package com.wifi.threat.exception;

/**
 * Exception thrown when a protected endpoint is called without the shared API key.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
