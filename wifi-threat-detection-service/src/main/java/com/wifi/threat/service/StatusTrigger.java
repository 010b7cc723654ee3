package com.wifi.threat.service;

import com.wifi.threat.dto.AccessPointStatus;

/** Events that may move an access point between statuses. */
public enum StatusTrigger {
    /** Operator marks the network as trusted. */
    MANUAL_TRUST,
    /** Operator marks the network as suspicious. */
    MANUAL_FLAG,
    /** Operator clears a previous decision. */
    MANUAL_RESET,
    /** Intake produced a harmful assessment. */
    HARMFUL_ASSESSMENT;

    /** The manual trigger that sets {@code status}. */
    public static StatusTrigger manual(AccessPointStatus status) {
        return switch (status) {
            case TRUSTED -> MANUAL_TRUST;
            case SUSPICIOUS -> MANUAL_FLAG;
            case UNKNOWN -> MANUAL_RESET;
        };
    }

    public boolean isManual() {
        return this != HARMFUL_ASSESSMENT;
    }
}
