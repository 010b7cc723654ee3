package com.wifi.threat.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.exception.ConcurrentUpdateException;
import com.wifi.threat.exception.ObservationStoreException;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Observation store: access point records keyed by upper-case BSSID.
 *
 * <p>Implementations translate store failures into {@link ObservationStoreException} and
 * version conflicts into {@link ConcurrentUpdateException}.
 */
public interface AccessPointRepository {

    /**
     * Find a record by its BSSID.
     *
     * @param bssid upper-case BSSID
     * @return the record if stored, empty otherwise
     */
    Optional<AccessPointRecord> findByBssid(String bssid);

    /**
     * Read every stored record. The result is a best-effort snapshot, not a consistent read
     * across concurrent writers.
     *
     * @return all records, in store order
     */
    List<AccessPointRecord> findAll();

    /**
     * Read the records whose persisted status equals {@code status}.
     *
     * @param status status to match
     * @return matching records
     */
    List<AccessPointRecord> findByStatus(AccessPointStatus status);

    /**
     * Conditionally write a record. The write succeeds only if the stored version still equals
     * the version the record was read with (or the key is absent for a new record).
     *
     * @param record record to write
     * @return the written record, carrying its new version
     * @throws ConcurrentUpdateException if the record changed since it was read
     */
    AccessPointRecord save(AccessPointRecord record);

    /**
     * Atomic read-modify-write of one record. The mutation receives the current record (or empty
     * when the key is new) and returns the record to write. On a version conflict the whole
     * cycle is repeated, up to {@code maxAttempts} times.
     *
     * @param bssid upper-case BSSID
     * @param mutation builds the new state from the current one; must not retain its argument
     * @param maxAttempts maximum number of read-modify-write cycles
     * @return the written record
     * @throws ConcurrentUpdateException if every attempt conflicted
     */
    default AccessPointRecord upsert(String bssid,
                                     Function<Optional<AccessPointRecord>, AccessPointRecord> mutation,
                                     int maxAttempts) {
        ConcurrentUpdateException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<AccessPointRecord> current = findByBssid(bssid);
            AccessPointRecord updated = mutation.apply(current.map(AccessPointRecord::copy));
            try {
                return save(updated);
            } catch (ConcurrentUpdateException e) {
                lastConflict = e;
            }
        }
        throw new ConcurrentUpdateException(
                "Record " + bssid + " kept changing after " + maxAttempts + " attempts", lastConflict);
    }

    /**
     * Validates table accessibility and measures response time for health checks.
     *
     * @return HealthCheckResult containing validation results and metrics
     * @throws ResourceNotFoundException if the table does not exist
     * @throws DynamoDbException if there are connectivity or permission issues
     */
    HealthCheckResult validateTableHealth();

    /**
     * Result object for health check operations containing metrics and validation results.
     */
    record HealthCheckResult(
            boolean isHealthy,
            long responseTimeMs,
            String tableName,
            long itemCount,
            String statusMessage
    ) {}
}
