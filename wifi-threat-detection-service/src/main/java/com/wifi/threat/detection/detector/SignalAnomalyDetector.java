package com.wifi.threat.detection.detector;

import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;
import com.wifi.threat.dto.SignalSample;

/**
 * Looks for signal behaviour consistent with deauthentication, jamming or probe flooding.
 *
 * <p>Needs at least {@code minimumHistory} samples. Over the most recent {@code windowSize}
 * samples a spread above {@code variationThresholdDbm} raises {@link ThreatType#SIGNAL_ANOMALY};
 * only when that does not fire, an observation count above {@code highFrequencyThreshold} raises
 * {@link ThreatType#HIGH_FREQUENCY}. At most one finding is produced per call.
 */
public class SignalAnomalyDetector implements ThreatDetector {

    private final int points;
    private final int minimumHistory;
    private final int windowSize;
    private final int variationThresholdDbm;
    private final int highFrequencyThreshold;

    public SignalAnomalyDetector(int points, int minimumHistory, int windowSize,
                                 int variationThresholdDbm, int highFrequencyThreshold) {
        this.points = points;
        this.minimumHistory = minimumHistory;
        this.windowSize = windowSize;
        this.variationThresholdDbm = variationThresholdDbm;
        this.highFrequencyThreshold = highFrequencyThreshold;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        List<SignalSample> history = context.history();
        if (history.size() < minimumHistory) {
            return Optional.empty();
        }

        IntSummaryStatistics recent = history.subList(Math.max(0, history.size() - windowSize), history.size())
                .stream()
                .map(SignalSample::getRssi)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .summaryStatistics();

        if (recent.getCount() > 0) {
            int variation = recent.getMax() - recent.getMin();
            if (variation > variationThresholdDbm) {
                return Optional.of(new ThreatFinding(
                        ThreatType.SIGNAL_ANOMALY,
                        Severity.MEDIUM,
                        "Unusual signal strength fluctuations detected",
                        String.format("Signal variation of %ddBm may indicate deauth attacks or jamming", variation)));
            }
        }

        Long observationCount = context.target().getObservationCount();
        if (observationCount != null && observationCount > highFrequencyThreshold) {
            return Optional.of(new ThreatFinding(
                    ThreatType.HIGH_FREQUENCY,
                    Severity.MEDIUM,
                    "Abnormally high detection frequency",
                    "This network appears unusually often, may indicate probe flooding"));
        }

        return Optional.empty();
    }
}
