package com.wifi.threat.detection;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.wifi.threat.detection.detector.ChannelCongestionDetector;
import com.wifi.threat.detection.detector.EvilTwinDetector;
import com.wifi.threat.detection.detector.OpenNetworkDetector;
import com.wifi.threat.detection.detector.SignalAnomalyDetector;
import com.wifi.threat.detection.detector.SuspiciousMacDetector;
import com.wifi.threat.detection.detector.SuspiciousSsidDetector;
import com.wifi.threat.detection.detector.ThreatDetector;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.SignalSample;

/**
 * Scores one access point against a snapshot of every stored record.
 *
 * <p>Six detectors run in a fixed order; every detector that fires contributes its finding and its
 * full points. Scores are summed without deduplication or ceiling, so an open network that is also
 * an evil twin is counted by both detectors.
 *
 * <p>The engine performs no I/O and keeps no state between calls. Evaluating the relational
 * detectors is {@code O(n)} in the size of {@code allRecords}; callers must hand in a snapshot that
 * does not change during the call.
 */
@Component
public class ThreatCorrelationEngine {

    private final ThreatRules rules;
    private final List<ThreatDetector> detectors;
    private final Clock clock;

    public ThreatCorrelationEngine(ThreatRules rules, Clock clock) {
        this.rules = rules;
        this.clock = clock;
        this.detectors = List.of(
                new SuspiciousSsidDetector(rules.suspiciousSsidPatterns(), rules.suspiciousSsidPoints()),
                new EvilTwinDetector(rules.evilTwinPoints()),
                new OpenNetworkDetector(rules.openNetworkPoints()),
                new SignalAnomalyDetector(
                        rules.signalAnomalyPoints(),
                        rules.signalHistoryMinimum(),
                        rules.signalWindowSize(),
                        rules.signalVariationThresholdDbm(),
                        rules.highFrequencyThreshold()),
                new ChannelCongestionDetector(rules.channelCongestionPoints(), rules.channelCongestionThreshold()),
                new SuspiciousMacDetector(rules.suspiciousMacPrefixes(), rules.suspiciousMacPoints()));
    }

    /**
     * Assesses {@code target}.
     *
     * @param target record under evaluation
     * @param allRecords snapshot of all records, normally including {@code target}
     * @param history the target's signal history, oldest first
     * @return a fresh assessment
     */
    public ThreatAssessment assessThreat(AccessPointRecord target, List<AccessPointRecord> allRecords,
                                         List<SignalSample> history) {
        AssessmentContext context = new AssessmentContext(target, allRecords, history);

        List<ThreatFinding> findings = new ArrayList<>();
        int harmScore = 0;
        for (ThreatDetector detector : detectors) {
            Optional<ThreatFinding> finding = detector.detect(context);
            if (finding.isPresent()) {
                findings.add(finding.get());
                harmScore += detector.points();
            }
        }

        RiskLevel riskLevel = RiskLevel.fromScore(harmScore, rules);
        return new ThreatAssessment(
                target.getBssid(),
                target.getSsid(),
                target.getBssid(),
                riskLevel,
                harmScore,
                List.copyOf(findings),
                RecommendationBuilder.build(riskLevel, findings),
                harmScore >= rules.harmfulThreshold(),
                clock.instant());
    }
}
