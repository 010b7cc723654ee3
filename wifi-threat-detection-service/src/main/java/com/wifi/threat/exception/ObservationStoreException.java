package com.wifi.threat.exception;

/**
 * Exception thrown when the observation store cannot be reached or rejects an operation.
 * Fatal for the request; the caller owns any retry.
 */
public class ObservationStoreException extends RuntimeException {

    public ObservationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
