package com.wifi.threat.detection.detector;

import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;
import com.wifi.threat.dto.EncryptionType;

/** Flags unencrypted networks. */
public class OpenNetworkDetector implements ThreatDetector {

    private final int points;

    public OpenNetworkDetector(int points) {
        this.points = points;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        if (context.target().encryption() != EncryptionType.OPEN) {
            return Optional.empty();
        }
        return Optional.of(new ThreatFinding(
                ThreatType.OPEN_NETWORK,
                Severity.MEDIUM,
                "Unsecured wireless network detected",
                "Open networks can be used for man-in-the-middle attacks and data interception"));
    }
}
