package com.wifi.threat.detection.detector;

import java.util.Objects;
import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;

/**
 * Flags channels crowded enough to suggest jamming. The count includes the target itself, so
 * every record on an over-threshold channel gets the finding.
 */
public class ChannelCongestionDetector implements ThreatDetector {

    private final int points;
    private final int threshold;

    public ChannelCongestionDetector(int points, int threshold) {
        this.points = points;
        this.threshold = threshold;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        Integer channel = context.target().getChannel();
        long sameChannel = context.allRecords().stream()
                .filter(other -> Objects.equals(other.getChannel(), channel))
                .count();

        if (sameChannel <= threshold) {
            return Optional.empty();
        }

        return Optional.of(new ThreatFinding(
                ThreatType.CHANNEL_CONGESTION,
                Severity.LOW,
                String.format("High network density on channel %s", channel),
                String.format("%d networks detected on same channel", sameChannel)));
    }
}
