package com.wifi.threat.detection;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk classification derived from a harm score. Thresholds are inclusive lower bounds and are
 * evaluated from {@link #CRITICAL} downwards.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RiskLevel fromScore(int harmScore, ThreatRules rules) {
        if (harmScore >= rules.criticalThreshold()) {
            return CRITICAL;
        } else if (harmScore >= rules.highThreshold()) {
            return HIGH;
        } else if (harmScore >= rules.mediumThreshold()) {
            return MEDIUM;
        }
        return LOW;
    }
}
