package com.wifi.threat.detection;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Security classification of one access point against a snapshot of all records. Derived on
 * demand and never persisted.
 *
 * @param accessPointId key of the assessed record (its BSSID)
 * @param ssid network name at assessment time
 * @param bssid radio identity
 * @param riskLevel classification of {@code harmScore}
 * @param harmScore sum of the points of every triggered detector
 * @param findings triggered detectors, in evaluation order
 * @param recommendation operator guidance
 * @param harmful whether the score reaches the harmful threshold
 * @param computedAt when the assessment was produced
 */
public record ThreatAssessment(
        @JsonProperty("accessPointId") String accessPointId,
        @JsonProperty("ssid") String ssid,
        @JsonProperty("bssid") String bssid,
        @JsonProperty("riskLevel") RiskLevel riskLevel,
        @JsonProperty("harmScore") int harmScore,
        @JsonProperty("threats") List<ThreatFinding> findings,
        @JsonProperty("recommendation") Recommendation recommendation,
        @JsonProperty("isHarmful") boolean harmful,
        @JsonProperty("computedAt") Instant computedAt) {

    public boolean hasFindings() {
        return findings != null && !findings.isEmpty();
    }
}
