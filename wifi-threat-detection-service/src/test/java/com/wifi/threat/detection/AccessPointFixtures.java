package com.wifi.threat.detection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.dto.SignalSample;

/** Builders for access point records used across detection and service tests. */
public final class AccessPointFixtures {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private AccessPointFixtures() {
    }

    public static AccessPointRecord record(String ssid, String bssid, String encryption, int channel) {
        return AccessPointRecord.builder()
                .ssid(ssid)
                .bssid(bssid)
                .encryptionType(encryption)
                .channel(channel)
                .rssi(-60)
                .firstSeen(NOW)
                .lastSeen(NOW)
                .observationCount(1L)
                .status(AccessPointStatus.UNKNOWN.getValue())
                .history(new ArrayList<>(List.of(new SignalSample(-60, NOW))))
                .build();
    }

    public static List<SignalSample> history(int... rssiValues) {
        List<SignalSample> samples = new ArrayList<>();
        for (int i = 0; i < rssiValues.length; i++) {
            samples.add(new SignalSample(rssiValues[i], NOW.plusSeconds(i)));
        }
        return samples;
    }

    /** {@code count} distinct records on the same channel. */
    public static List<AccessPointRecord> sameChannel(int count, int channel) {
        List<AccessPointRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record("Net" + i, String.format("10:00:00:00:00:%02X", i), "WPA2", channel));
        }
        return records;
    }
}
