package com.wifi.threat.detection;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a single finding. */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
