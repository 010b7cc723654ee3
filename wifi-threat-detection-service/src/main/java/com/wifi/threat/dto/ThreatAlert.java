package com.wifi.threat.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wifi.threat.detection.Recommendation;
import com.wifi.threat.detection.RiskLevel;
import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.detection.ThreatFinding;

/**
 * Immediate alert for a record that produced findings during intake.
 */
public record ThreatAlert(
        @JsonProperty("ssid") String ssid,
        @JsonProperty("bssid") String bssid,
        @JsonProperty("riskLevel") RiskLevel riskLevel,
        @JsonProperty("harmScore") int harmScore,
        @JsonProperty("threats") List<ThreatFinding> threats,
        @JsonProperty("recommendation") Recommendation recommendation,
        @JsonProperty("isHarmful") boolean harmful) {

    public static ThreatAlert from(ThreatAssessment assessment) {
        return new ThreatAlert(
                assessment.ssid(),
                assessment.bssid(),
                assessment.riskLevel(),
                assessment.harmScore(),
                assessment.findings(),
                assessment.recommendation(),
                assessment.harmful());
    }
}
