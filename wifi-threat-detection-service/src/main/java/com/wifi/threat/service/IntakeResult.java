package com.wifi.threat.service;

import java.util.List;

import com.wifi.threat.detection.RiskLevel;
import com.wifi.threat.dto.SecuritySummary;
import com.wifi.threat.dto.ThreatAlert;

/**
 * Outcome of one ingested batch.
 *
 * @param processed reports written to the store
 * @param created reports that created a new record
 * @param updated reports that refreshed an existing record
 * @param errors per-item failures, one human readable line each
 * @param threats alerts for records that produced at least one finding
 */
public record IntakeResult(
        int processed,
        int created,
        int updated,
        List<String> errors,
        List<ThreatAlert> threats) {

    public SecuritySummary securitySummary() {
        return SecuritySummary.builder()
                .threatsDetected(threats.size())
                .criticalThreats(countAt(RiskLevel.CRITICAL))
                .highThreats(countAt(RiskLevel.HIGH))
                .harmfulNetworks((int) threats.stream().filter(ThreatAlert::harmful).count())
                .build();
    }

    private int countAt(RiskLevel level) {
        return (int) threats.stream().filter(alert -> alert.riskLevel() == level).count();
    }
}
