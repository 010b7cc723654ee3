package com.wifi.threat.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.wifi.threat.dto.AccessPointStatus;

@DisplayName("Status State Machine Tests")
class StatusStateMachineTest {

    @Test
    void should_EscalateToSuspicious_When_UnknownAndHarmful() {
        assertThat(StatusStateMachine.transition(AccessPointStatus.UNKNOWN, StatusTrigger.HARMFUL_ASSESSMENT))
                .contains(AccessPointStatus.SUSPICIOUS);
    }

    @Test
    void should_NeverFlipTrusted_When_Harmful() {
        assertThat(StatusStateMachine.transition(AccessPointStatus.TRUSTED, StatusTrigger.HARMFUL_ASSESSMENT))
                .isEmpty();
    }

    @Test
    void should_DoNothing_When_AlreadySuspiciousAndHarmful() {
        assertThat(StatusStateMachine.transition(AccessPointStatus.SUSPICIOUS, StatusTrigger.HARMFUL_ASSESSMENT))
                .isEmpty();
    }

    @ParameterizedTest
    @EnumSource(AccessPointStatus.class)
    @DisplayName("Operator may set any status from any other")
    void should_ApplyManualTrigger_FromAnyStatus(AccessPointStatus requested) {
        for (AccessPointStatus current : AccessPointStatus.values()) {
            if (current == requested) {
                assertThat(StatusStateMachine.transition(current, StatusTrigger.manual(requested))).isEmpty();
            } else {
                assertThat(StatusStateMachine.transition(current, StatusTrigger.manual(requested))).contains(requested);
            }
        }
    }

    @Test
    void should_MapStatusesToManualTriggers() {
        assertThat(StatusTrigger.manual(AccessPointStatus.TRUSTED)).isEqualTo(StatusTrigger.MANUAL_TRUST);
        assertThat(StatusTrigger.manual(AccessPointStatus.SUSPICIOUS)).isEqualTo(StatusTrigger.MANUAL_FLAG);
        assertThat(StatusTrigger.manual(AccessPointStatus.UNKNOWN)).isEqualTo(StatusTrigger.MANUAL_RESET);
        assertThat(StatusTrigger.HARMFUL_ASSESSMENT.isManual()).isFalse();
    }
}
