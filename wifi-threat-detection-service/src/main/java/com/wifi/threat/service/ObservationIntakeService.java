package com.wifi.threat.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.threat.config.ThreatDetectionProperties;
import com.wifi.threat.detection.ThreatAssessment;
import com.wifi.threat.detection.ThreatCorrelationEngine;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.dto.EncryptionType;
import com.wifi.threat.dto.ObservationReport;
import com.wifi.threat.dto.SignalSample;
import com.wifi.threat.dto.ThreatAlert;
import com.wifi.threat.exception.ObservationStoreException;
import com.wifi.threat.repository.AccessPointRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Intake pipeline for sensor scan batches.
 *
 * <p>Reports are handled one at a time in list order. Each raw entry is bound to an
 * {@link ObservationReport} and its record is upserted. The correlation engine then runs against
 * a fresh read of the whole store in which the target is replaced by the version just written,
 * and a harmful assessment escalates an {@code unknown} record to {@code suspicious} before the
 * next report is touched.
 *
 * <p>A report without a BSSID, one that does not bind, or one whose write keeps conflicting is
 * recorded as a per-item error and the batch continues. An unavailable store aborts the batch with
 * {@link ObservationStoreException}.
 */
@Service
@Slf4j
public class ObservationIntakeService {

    private static final String METRIC_NETWORKS = "wifi.threat.scan.networks";
    private static final String METRIC_ESCALATIONS = "wifi.threat.escalations";

    private final AccessPointRepository repository;
    private final ThreatCorrelationEngine engine;
    private final ThreatDetectionProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final Counter createdCounter;
    private final Counter updatedCounter;
    private final Counter errorCounter;
    private final Counter escalationCounter;

    public ObservationIntakeService(AccessPointRepository repository,
                                    ThreatCorrelationEngine engine,
                                    ThreatDetectionProperties properties,
                                    Clock clock,
                                    ObjectMapper objectMapper,
                                    MeterRegistry meterRegistry) {
        this.repository = repository;
        this.engine = engine;
        this.properties = properties;
        this.clock = clock;
        this.objectMapper = objectMapper;

        this.createdCounter = Counter.builder(METRIC_NETWORKS)
                .description("Observation reports that created a new access point record")
                .tag("result", "created")
                .register(meterRegistry);
        this.updatedCounter = Counter.builder(METRIC_NETWORKS)
                .description("Observation reports that refreshed an existing access point record")
                .tag("result", "updated")
                .register(meterRegistry);
        this.errorCounter = Counter.builder(METRIC_NETWORKS)
                .description("Observation reports rejected or failed")
                .tag("result", "error")
                .register(meterRegistry);
        this.escalationCounter = Counter.builder(METRIC_ESCALATIONS)
                .description("Automatic unknown to suspicious escalations")
                .register(meterRegistry);
    }

    /**
     * Ingests one batch.
     *
     * @param deviceId reporting sensor; the configured default is used when blank
     * @param networks raw observation reports in the order they were scanned
     * @return per-batch counters, errors and alerts
     * @throws ObservationStoreException if the store cannot be reached
     */
    public IntakeResult ingest(String deviceId, List<JsonNode> networks) {
        String sourceDeviceId = deviceId == null || deviceId.isBlank() ? properties.defaultDeviceId() : deviceId;
        log.info("Received {} networks from {}", networks.size(), sourceDeviceId);

        int processed = 0;
        int created = 0;
        int updated = 0;
        List<String> errors = new ArrayList<>();
        List<ThreatAlert> threats = new ArrayList<>();

        for (JsonNode network : networks) {
            String bssid = textField(network, "bssid");
            if (bssid == null || bssid.isBlank()) {
                String ssid = textField(network, "ssid");
                errors.add("Missing BSSID for network: " + ssid);
                errorCounter.increment();
                log.warn("Rejected report without BSSID (ssid: {}) from {}", ssid, sourceDeviceId);
                continue;
            }

            try {
                ObservationReport report = toReport(network);
                AccessPointRecord saved = upsertObservation(report, sourceDeviceId);
                if (saved.getObservationCount() == 1) {
                    created++;
                    createdCounter.increment();
                } else {
                    updated++;
                    updatedCounter.increment();
                }
                processed++;

                ThreatAssessment assessment =
                        engine.assessThreat(saved, snapshotWith(saved), saved.getHistory());
                if (assessment.harmful()) {
                    escalate(saved);
                }
                if (assessment.hasFindings()) {
                    threats.add(ThreatAlert.from(assessment));
                }
            } catch (ObservationStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                errors.add("Error processing " + bssid + ": " + e.getMessage());
                errorCounter.increment();
                log.warn("Failed to process report for {} from {}: {}", bssid, sourceDeviceId, e.getMessage());
            }
        }

        log.info("Batch from {} processed: {} processed, {} created, {} updated, {} errors, {} threats",
                sourceDeviceId, processed, created, updated, errors.size(), threats.size());
        return new IntakeResult(processed, created, updated, List.copyOf(errors), List.copyOf(threats));
    }

    private ObservationReport toReport(JsonNode network) {
        try {
            return objectMapper.treeToValue(network, ObservationReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed network report: " + e.getOriginalMessage(), e);
        }
    }

    /** Full record set with the target replaced by the version just written. */
    private List<AccessPointRecord> snapshotWith(AccessPointRecord saved) {
        List<AccessPointRecord> snapshot = new ArrayList<>();
        boolean replaced = false;
        for (AccessPointRecord record : repository.findAll()) {
            if (saved.getBssid().equals(record.getBssid())) {
                snapshot.add(saved);
                replaced = true;
            } else {
                snapshot.add(record);
            }
        }
        if (!replaced) {
            snapshot.add(saved);
        }
        return snapshot;
    }

    private static String textField(JsonNode network, String field) {
        if (network == null || !network.isObject()) {
            return null;
        }
        JsonNode value = network.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private AccessPointRecord upsertObservation(ObservationReport report, String sourceDeviceId) {
        if (report.getRssi() == null || report.getChannel() == null) {
            throw new IllegalArgumentException("rssi and channel are required");
        }

        String bssid = normalizeBssid(report.getBssid());
        return repository.upsert(
                bssid,
                current -> {
                    Instant now = clock.instant();
                    return current
                            .map(existing -> applyObservation(existing, report, sourceDeviceId, now))
                            .orElseGet(() -> newRecord(bssid, report, sourceDeviceId, now));
                },
                properties.upsertMaxAttempts());
    }

    private AccessPointRecord newRecord(String bssid, ObservationReport report, String sourceDeviceId, Instant now) {
        AccessPointRecord record = AccessPointRecord.builder()
                .bssid(bssid)
                .ssid(displaySsid(report.getSsid()))
                .rssi(report.getRssi())
                .channel(report.getChannel())
                .encryptionType(EncryptionType.fromLabel(report.getEncType()).getLabel())
                .firstSeen(now)
                .lastSeen(now)
                .observationCount(1L)
                .status(AccessPointStatus.UNKNOWN.getValue())
                .sourceDeviceId(sourceDeviceId)
                .build();
        record.appendSample(new SignalSample(report.getRssi(), now), properties.historyLimit());
        return record;
    }

    private AccessPointRecord applyObservation(AccessPointRecord record, ObservationReport report,
                                               String sourceDeviceId, Instant now) {
        record.setSsid(displaySsid(report.getSsid()));
        record.setRssi(report.getRssi());
        record.setChannel(report.getChannel());
        record.setEncryptionType(EncryptionType.fromLabel(report.getEncType()).getLabel());
        record.setLastSeen(now);
        record.setSourceDeviceId(sourceDeviceId);
        record.setObservationCount(record.getObservationCount() == null ? 1L : record.getObservationCount() + 1);
        record.appendSample(new SignalSample(report.getRssi(), now), properties.historyLimit());
        return record;
    }

    /**
     * Applies the automatic escalation. The guard is re-evaluated against the freshly read
     * status so a manual decision made in the meantime is left alone.
     */
    private void escalate(AccessPointRecord assessed) {
        if (StatusStateMachine.transition(assessed.accessPointStatus(), StatusTrigger.HARMFUL_ASSESSMENT).isEmpty()) {
            return;
        }

        AtomicBoolean escalated = new AtomicBoolean();
        AccessPointRecord written = repository.upsert(
                assessed.getBssid(),
                current -> {
                    AccessPointRecord record = current.orElseGet(assessed::copy);
                    Optional<AccessPointStatus> next =
                            StatusStateMachine.transition(record.accessPointStatus(), StatusTrigger.HARMFUL_ASSESSMENT);
                    next.ifPresent(status -> record.setStatus(status.getValue()));
                    escalated.set(next.isPresent());
                    return record;
                },
                properties.upsertMaxAttempts());

        if (escalated.get()) {
            escalationCounter.increment();
            log.info("Access point {} ({}) escalated to suspicious by automatic assessment",
                    written.getBssid(), written.getSsid());
        }
    }

    static String normalizeBssid(String bssid) {
        return bssid.trim().toUpperCase(Locale.ROOT);
    }

    private static String displaySsid(String ssid) {
        return ssid == null || ssid.isEmpty() ? AccessPointRecord.HIDDEN_NETWORK_SSID : ssid;
    }
}
