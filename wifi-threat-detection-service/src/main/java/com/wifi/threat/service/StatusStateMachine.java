package com.wifi.threat.service;

import java.util.Optional;

import com.wifi.threat.dto.AccessPointStatus;

/**
 * Guarded status transitions.
 *
 * <p>Manual triggers always apply: an operator may set any of the three statuses. The only
 * automatic transition is {@code unknown -> suspicious} on a harmful assessment; from any other
 * status the automatic trigger is a no-op, so an operator decision is never overridden by a later
 * evaluation.
 */
public final class StatusStateMachine {

    private StatusStateMachine() {
    }

    /**
     * @param current status the record holds now
     * @param trigger event being applied
     * @return the new status, or empty when the trigger does not change anything
     */
    public static Optional<AccessPointStatus> transition(AccessPointStatus current, StatusTrigger trigger) {
        AccessPointStatus target = switch (trigger) {
            case MANUAL_TRUST -> AccessPointStatus.TRUSTED;
            case MANUAL_FLAG -> AccessPointStatus.SUSPICIOUS;
            case MANUAL_RESET -> AccessPointStatus.UNKNOWN;
            case HARMFUL_ASSESSMENT -> current == AccessPointStatus.UNKNOWN ? AccessPointStatus.SUSPICIOUS : null;
        };
        if (target == null || target == current) {
            return Optional.empty();
        }
        return Optional.of(target);
    }
}
