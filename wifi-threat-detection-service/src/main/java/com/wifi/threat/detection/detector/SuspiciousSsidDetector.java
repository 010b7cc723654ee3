package com.wifi.threat.detection.detector;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;
import com.wifi.threat.dto.AccessPointRecord;

/** Flags network names commonly used as social engineering bait ("Free WiFi", "hotspot"...). */
public class SuspiciousSsidDetector implements ThreatDetector {

    private final List<Pattern> patterns;
    private final int points;

    public SuspiciousSsidDetector(List<Pattern> patterns, int points) {
        this.patterns = List.copyOf(patterns);
        this.points = points;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        String ssid = context.target().getSsid();
        if (ssid == null || ssid.isEmpty() || AccessPointRecord.HIDDEN_NETWORK_SSID.equals(ssid)) {
            return Optional.empty();
        }

        boolean deceptive = patterns.stream().anyMatch(pattern -> pattern.matcher(ssid).find());
        if (!deceptive) {
            return Optional.empty();
        }

        return Optional.of(new ThreatFinding(
                ThreatType.SUSPICIOUS_SSID,
                Severity.MEDIUM,
                String.format("Potentially deceptive network name: \"%s\"", ssid),
                "This SSID pattern is commonly used by attackers for social engineering"));
    }
}
