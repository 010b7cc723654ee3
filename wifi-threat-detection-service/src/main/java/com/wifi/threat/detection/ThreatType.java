package com.wifi.threat.detection;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of finding a detector can raise. */
public enum ThreatType {
    SUSPICIOUS_SSID("suspicious_ssid"),
    EVIL_TWIN("evil_twin"),
    OPEN_NETWORK("open_network"),
    SIGNAL_ANOMALY("signal_anomaly"),
    HIGH_FREQUENCY("high_frequency"),
    CHANNEL_CONGESTION("channel_congestion"),
    SUSPICIOUS_MAC("suspicious_mac");

    private final String code;

    ThreatType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
