package com.wifi.threat.detection.detector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.wifi.threat.detection.AssessmentContext;
import com.wifi.threat.detection.Severity;
import com.wifi.threat.detection.ThreatFinding;
import com.wifi.threat.detection.ThreatType;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.EncryptionType;

/**
 * Detects a radio impersonating another network's name with weaker security.
 *
 * <p>Fires when at least one other BSSID advertises the same SSID and either the target is open
 * or a sibling's encryption is strictly stronger than the target's.
 */
public class EvilTwinDetector implements ThreatDetector {

    private final int points;

    public EvilTwinDetector(int points) {
        this.points = points;
    }

    @Override
    public int points() {
        return points;
    }

    @Override
    public Optional<ThreatFinding> detect(AssessmentContext context) {
        AccessPointRecord target = context.target();
        List<AccessPointRecord> siblings = context.allRecords().stream()
                .filter(other -> Objects.equals(other.getSsid(), target.getSsid()))
                .filter(other -> !Objects.equals(other.getBssid(), target.getBssid()))
                .toList();

        if (siblings.isEmpty()) {
            return Optional.empty();
        }

        EncryptionType targetEncryption = target.encryption();
        boolean siblingStronger = siblings.stream()
                .anyMatch(other -> other.encryption().isStrongerThan(targetEncryption));

        if (targetEncryption != EncryptionType.OPEN && !siblingStronger) {
            return Optional.empty();
        }

        return Optional.of(new ThreatFinding(
                ThreatType.EVIL_TWIN,
                Severity.HIGH,
                String.format("Potential Evil Twin attack detected for \"%s\"", target.getSsid()),
                String.format("Found %d networks with same name but different security levels", siblings.size() + 1)));
    }
}
