package com.wifi.threat.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.wifi.threat.config.ThreatDetectionProperties;
import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.detection.ThreatCorrelationEngine;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.dto.NetworkQuery;
import com.wifi.threat.dto.NetworkStats;
import com.wifi.threat.exception.AccessPointNotFoundException;
import com.wifi.threat.exception.InvalidStatusException;
import com.wifi.threat.repository.AccessPointRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Dashboard-facing reads and operator status changes over access point records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessPointQueryService {

    private final AccessPointRepository repository;
    private final ThreatCorrelationEngine engine;
    private final ThreatDetectionProperties properties;
    private final Clock clock;

    /**
     * Lists records filtered by persisted status and free-text search, sorted and truncated.
     * An unrecognised status filter matches nothing; a non-positive limit means no limit.
     */
    public List<AccessPointRecord> listAccessPoints(NetworkQuery query) {
        List<AccessPointRecord> candidates;
        if (query.hasStatusFilter()) {
            candidates = AccessPointStatus.fromValue(query.status())
                    .map(repository::findByStatus)
                    .orElse(List.of());
        } else {
            candidates = repository.findAll();
        }

        Stream<AccessPointRecord> stream = candidates.stream();
        if (query.hasSearch()) {
            String needle = query.search().toLowerCase(Locale.ROOT);
            stream = stream.filter(record -> contains(record.getSsid(), needle) || contains(record.getBssid(), needle));
        }
        stream = stream.sorted(comparatorFor(query.sortBy(), query.isDescending()));
        if (query.limit() > 0) {
            stream = stream.limit(query.limit());
        }
        return stream.toList();
    }

    /**
     * Applies an operator status change. Manual changes are always permitted.
     *
     * @throws InvalidStatusException if {@code statusValue} is not a valid status
     * @throws AccessPointNotFoundException if no record exists for {@code bssid}
     */
    public AccessPointRecord updateStatus(String bssid, String statusValue) {
        AccessPointStatus requested = AccessPointStatus.fromValue(statusValue)
                .orElseThrow(() -> new InvalidStatusException(statusValue));
        String key = normalize(bssid);
        StatusTrigger trigger = StatusTrigger.manual(requested);

        AccessPointRecord updated = repository.upsert(
                key,
                current -> {
                    AccessPointRecord record = current.orElseThrow(() -> new AccessPointNotFoundException(key));
                    StatusStateMachine.transition(record.accessPointStatus(), trigger)
                            .ifPresent(status -> record.setStatus(status.getValue()));
                    return record;
                },
                properties.upsertMaxAttempts());

        log.info("Access point {} status set to {} by operator", key, updated.getStatus());
        return updated;
    }

    public NetworkStats getStats() {
        List<AccessPointRecord> records = repository.findAll();
        Instant activeSince = clock.instant().minus(properties.recentlyActiveWindow());

        return NetworkStats.builder()
                .total(records.size())
                .recentlyActive(records.stream()
                        .filter(record -> record.getLastSeen() != null && !record.getLastSeen().isBefore(activeSince))
                        .count())
                .trusted(countWithStatus(records, AccessPointStatus.TRUSTED))
                .unknown(countWithStatus(records, AccessPointStatus.UNKNOWN))
                .suspicious(countWithStatus(records, AccessPointStatus.SUSPICIOUS))
                .build();
    }

    /**
     * Fresh assessment of one record against the current store.
     *
     * @throws AccessPointNotFoundException if no record exists for {@code bssid}
     */
    public ThreatAssessment assessAccessPoint(String bssid) {
        String key = normalize(bssid);
        AccessPointRecord record = repository.findByBssid(key)
                .orElseThrow(() -> new AccessPointNotFoundException(key));
        return engine.assessThreat(record, repository.findAll(), record.getHistory());
    }

    private static long countWithStatus(List<AccessPointRecord> records, AccessPointStatus status) {
        return records.stream().filter(record -> record.accessPointStatus() == status).count();
    }

    private static boolean contains(String value, String lowerCaseNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
    }

    private static String normalize(String bssid) {
        return bssid == null ? "" : bssid.trim().toUpperCase(Locale.ROOT);
    }

    static Comparator<AccessPointRecord> comparatorFor(String sortBy, boolean descending) {
        String key = sortBy == null ? NetworkQuery.DEFAULT_SORT_BY : sortBy;
        return switch (key) {
            case "firstSeen" -> by(AccessPointRecord::getFirstSeen, descending);
            case "ssid" -> by(AccessPointRecord::getSsid, descending);
            case "bssid" -> by(AccessPointRecord::getBssid, descending);
            case "rssi" -> by(AccessPointRecord::getRssi, descending);
            case "channel" -> by(AccessPointRecord::getChannel, descending);
            case "observationCount" -> by(AccessPointRecord::getObservationCount, descending);
            case "status" -> by(AccessPointRecord::getStatus, descending);
            case "encryptionType" -> by(AccessPointRecord::getEncryptionType, descending);
            default -> by(AccessPointRecord::getLastSeen, descending);
        };
    }

    private static <T extends Comparable<? super T>> Comparator<AccessPointRecord> by(
            Function<AccessPointRecord, T> field, boolean descending) {
        Comparator<T> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        return Comparator.comparing(field, Comparator.nullsLast(order));
    }
}
