package com.wifi.threat.repository;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import com.wifi.threat.config.DynamoDbProperties;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.dto.AccessPointStatus;
import com.wifi.threat.exception.ConcurrentUpdateException;
import com.wifi.threat.exception.ObservationStoreException;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * DynamoDB implementation of the AccessPointRepository interface.
 *
 * <p>Writes go through {@code updateItem} so the enhanced client's versioned record extension
 * both guards the write with the version read earlier and hands back the new version. A failed
 * version condition surfaces as {@link ConcurrentUpdateException}; any other SDK failure as
 * {@link ObservationStoreException}. No retry happens here beyond the read-modify-write cycle of
 * {@link AccessPointRepository#upsert}.
 *
 * <p>Key lookups and scans are strongly consistent so a read-modify-write never starts from a
 * stale version and a scan sees the write that preceded it. The status index only supports
 * eventually consistent queries.
 */
@Repository
@Profile("!test")
public class AccessPointRepositoryImpl implements AccessPointRepository {

    static final String STATUS_INDEX = "StatusIndex";

    /** Health check latency above which the table is reported as degraded. */
    private static final long LATENCY_THRESHOLD_MS = 1_000L;

    private static final long NANOS_TO_MILLIS = 1_000_000L;

    private static final String HEALTHY_STATUS_MESSAGE = "Table is accessible and healthy";
    private static final String SLOW_RESPONSE_STATUS_MESSAGE = "Table response time exceeds threshold";

    private static final Logger logger = LoggerFactory.getLogger(AccessPointRepositoryImpl.class);

    private final DynamoDbTable<AccessPointRecord> accessPointTable;
    private final String tableName;

    public AccessPointRepositoryImpl(DynamoDbEnhancedClient enhancedClient, DynamoDbProperties properties) {
        this.tableName = properties.tableName();
        this.accessPointTable = enhancedClient.table(tableName, TableSchema.fromBean(AccessPointRecord.class));
        logger.info("Initialized AccessPointRepository with table: {}", tableName);
    }

    @Override
    public Optional<AccessPointRecord> findByBssid(String bssid) {
        logger.debug("Querying access point by partition key (BSSID): {}", bssid);
        try {
            GetItemEnhancedRequest request = GetItemEnhancedRequest.builder()
                    .key(Key.builder().partitionValue(bssid).build())
                    .consistentRead(true)
                    .build();
            return Optional.ofNullable(accessPointTable.getItem(request));
        } catch (SdkException e) {
            logger.error("Error retrieving access point by BSSID: {}", bssid, e);
            throw new ObservationStoreException("Failed to retrieve access point " + bssid, e);
        }
    }

    @Override
    public List<AccessPointRecord> findAll() {
        try {
            List<AccessPointRecord> records = accessPointTable
                    .scan(ScanEnhancedRequest.builder().consistentRead(true).build())
                    .items().stream().toList();
            logger.debug("Scanned {} access points from table {}", records.size(), tableName);
            return records;
        } catch (SdkException e) {
            logger.error("Error scanning access points from table {}", tableName, e);
            throw new ObservationStoreException("Failed to read access points", e);
        }
    }

    @Override
    public List<AccessPointRecord> findByStatus(AccessPointStatus status) {
        try {
            DynamoDbIndex<AccessPointRecord> statusIndex = accessPointTable.index(STATUS_INDEX);
            QueryConditional condition = QueryConditional.keyEqualTo(
                    Key.builder().partitionValue(status.getValue()).build());
            return statusIndex.query(condition).stream()
                    .flatMap(page -> page.items().stream())
                    .toList();
        } catch (SdkException e) {
            logger.error("Error querying access points by status {}", status.getValue(), e);
            throw new ObservationStoreException("Failed to read access points by status", e);
        }
    }

    @Override
    public AccessPointRecord save(AccessPointRecord record) {
        try {
            return accessPointTable.updateItem(record);
        } catch (ConditionalCheckFailedException e) {
            logger.debug("Version conflict writing access point {}", record.getBssid());
            throw new ConcurrentUpdateException("Access point " + record.getBssid() + " was modified concurrently", e);
        } catch (SdkException e) {
            logger.error("Error writing access point {}", record.getBssid(), e);
            throw new ObservationStoreException("Failed to write access point " + record.getBssid(), e);
        }
    }

    @Override
    public HealthCheckResult validateTableHealth() {
        long startTime = System.nanoTime();

        long itemCount = accessPointTable.describeTable().table().itemCount();

        long responseTimeMs = (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
        boolean healthy = responseTimeMs < LATENCY_THRESHOLD_MS;

        return new HealthCheckResult(
                healthy,
                responseTimeMs,
                tableName,
                itemCount,
                healthy ? HEALTHY_STATUS_MESSAGE : SLOW_RESPONSE_STATUS_MESSAGE);
    }
}
