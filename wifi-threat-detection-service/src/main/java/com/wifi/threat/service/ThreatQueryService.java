package com.wifi.threat.service;

import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;

import com.wifi.threat.detection.RiskLevel;
import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.detection.ThreatCorrelationEngine;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.ThreatSummary;
import com.wifi.threat.repository.AccessPointRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recomputes threat assessments for every stored record.
 *
 * <p>Each record is assessed against the same loaded snapshot, so the cost is quadratic in the
 * number of records. No lock is taken; under concurrent intake the report reflects whatever the
 * store returned at read time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThreatQueryService {

    private final AccessPointRepository repository;
    private final ThreatCorrelationEngine engine;

    public ThreatReport generateThreatReport() {
        List<AccessPointRecord> records = repository.findAll();

        // stream sort is stable, so equal scores keep store read order
        List<ThreatAssessment> threats = records.stream()
                .map(record -> engine.assessThreat(record, records, record.getHistory()))
                .filter(assessment -> assessment.harmScore() > 0 || assessment.hasFindings())
                .sorted(Comparator.comparingInt(ThreatAssessment::harmScore).reversed())
                .toList();

        ThreatSummary summary = ThreatSummary.builder()
                .total(threats.size())
                .critical(countAt(threats, RiskLevel.CRITICAL))
                .high(countAt(threats, RiskLevel.HIGH))
                .medium(countAt(threats, RiskLevel.MEDIUM))
                .low(countAt(threats, RiskLevel.LOW))
                .harmful((int) threats.stream().filter(ThreatAssessment::harmful).count())
                .build();

        log.debug("Threat report over {} records: {} threats, {} critical", records.size(), threats.size(),
                summary.getCritical());
        return new ThreatReport(summary, threats);
    }

    private static int countAt(List<ThreatAssessment> threats, RiskLevel level) {
        return (int) threats.stream().filter(assessment -> assessment.riskLevel() == level).count();
    }
}
