package com.wifi.threat.dto;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonValue;

/** Operator-facing trust status of an access point record. */
public enum AccessPointStatus {
    UNKNOWN("unknown"),
    TRUSTED("trusted"),
    SUSPICIOUS("suspicious");

    private final String value;

    AccessPointStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a status value exactly as stored or submitted (lowercase).
     *
     * @param value raw status value
     * @return the matching status, or empty when the value is not one of the valid statuses
     */
    public static Optional<AccessPointStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(status -> status.value.equals(value)).findFirst();
    }

    /** Comma separated list of valid values. */
    public static String validValues() {
        return Arrays.stream(values()).map(AccessPointStatus::getValue).collect(Collectors.joining(", "));
    }
}
