package com.wifi.threat.detection.detector;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;

/** Flags BSSIDs whose first three octets match placeholder or locally administered prefixes. */
public class SuspiciousMacDetector implements ThreatDetector {

    private static final int PREFIX_LENGTH = 8;

    private final List<String> prefixes;
    private final int points;

    public SuspiciousMacDetector(List<String> prefixes, int points) {
        this.prefixes = prefixes.stream().map(prefix -> prefix.toUpperCase(Locale.ROOT)).toList();
        this.points = points;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        String bssid = context.target().getBssid();
        if (bssid == null || bssid.isEmpty()) {
            return Optional.empty();
        }

        String prefix = bssid.substring(0, Math.min(PREFIX_LENGTH, bssid.length())).toUpperCase(Locale.ROOT);
        if (prefixes.stream().noneMatch(prefix::startsWith)) {
            return Optional.empty();
        }

        return Optional.of(new ThreatFinding(
                ThreatType.SUSPICIOUS_MAC,
                Severity.LOW,
                "Potentially spoofed MAC address detected",
                "MAC address pattern suggests possible device identity masking"));
    }
}
