package com.wifi.threat.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encryption scheme advertised by an access point.
 *
 * <p>Each scheme carries a strength rank used when comparing networks that share a name:
 * Open &lt; WEP &lt; {WPA, WPA2, WPA3}. The WPA family shares one rank. {@link #UNKNOWN} has no
 * rank and never compares as stronger or weaker than anything.
 */
public enum EncryptionType {
    OPEN("Open", 0),
    WEP("WEP", 1),
    WPA("WPA", 2),
    WPA2("WPA2", 2),
    WPA3("WPA3", 2),
    UNKNOWN("Unknown", -1);

    private final String label;
    private final int strength;

    EncryptionType(String label, int strength) {
        this.label = label;
        this.strength = strength;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isRanked() {
        return strength >= 0;
    }

    /**
     * Whether this scheme is strictly stronger than the other. Unranked schemes are never
     * stronger or weaker.
     */
    public boolean isStrongerThan(EncryptionType other) {
        if (other == null || !isRanked() || !other.isRanked()) {
            return false;
        }
        return strength > other.strength;
    }

    /**
     * Resolves a reported label, case-insensitively. Blank or unrecognised labels map to
     * {@link #UNKNOWN}.
     */
    @JsonCreator
    public static EncryptionType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = label.trim();
        for (EncryptionType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
