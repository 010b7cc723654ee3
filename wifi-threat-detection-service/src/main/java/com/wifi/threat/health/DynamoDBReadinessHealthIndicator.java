package com.wifi.threat.health;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.wifi.threat.repository.AccessPointRepository;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Readiness of the observation store.
 *
 * <p>Delegates to {@link AccessPointRepository#validateTableHealth()} and reports:
 * UP when the table answers within the latency threshold, DOWN when it is slow, missing or
 * unreachable, OUT_OF_SERVICE for anything unexpected.
 */
@Component("dynamoDBReadiness")
public class DynamoDBReadinessHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBReadinessHealthIndicator.class);

    private static final String DATABASE_TYPE = "DynamoDB";

    private static final String DYNAMODB_ACCESSIBLE_MESSAGE = "DynamoDB is accessible";
    private static final String DYNAMODB_NOT_ACCESSIBLE_MESSAGE = "DynamoDB is not accessible";
    private static final String DYNAMODB_TABLE_NOT_FOUND_MESSAGE = "DynamoDB table not found";
    private static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error during health check";

    private static final String STATUS_KEY = "status";
    private static final String DATABASE_KEY = "database";
    private static final String TABLE_NAME_KEY = "tableName";
    private static final String LAST_CHECKED_KEY = "lastChecked";
    private static final String RESPONSE_TIME_KEY = "responseTimeMs";
    private static final String ITEM_COUNT_KEY = "itemCount";
    private static final String ERROR_KEY = "error";

    private static final long NANOS_TO_MILLIS = 1_000_000L;

    private final AccessPointRepository repository;

    public DynamoDBReadinessHealthIndicator(AccessPointRepository repository) {
        this.repository = repository;
    }

    @Override
    public Health health() {
        Instant lastChecked = Instant.now();
        long startTime = System.nanoTime();

        try {
            AccessPointRepository.HealthCheckResult result = repository.validateTableHealth();

            Health.Builder builder = result.isHealthy() ? Health.up() : Health.down();
            if (result.isHealthy()) {
                logger.debug("Observation store healthy - table: {}, response time: {}ms, items: {}",
                        result.tableName(), result.responseTimeMs(), result.itemCount());
            } else {
                logger.warn("Observation store degraded - table: {}, response time: {}ms, status: {}",
                        result.tableName(), result.responseTimeMs(), result.statusMessage());
            }

            return builder
                    .withDetail(STATUS_KEY, result.isHealthy() ? DYNAMODB_ACCESSIBLE_MESSAGE : result.statusMessage())
                    .withDetail(DATABASE_KEY, DATABASE_TYPE)
                    .withDetail(TABLE_NAME_KEY, result.tableName())
                    .withDetail(LAST_CHECKED_KEY, lastChecked)
                    .withDetail(RESPONSE_TIME_KEY, result.responseTimeMs())
                    .withDetail(ITEM_COUNT_KEY, result.itemCount())
                    .build();

        } catch (ResourceNotFoundException e) {
            logger.warn("Observation store table not found ({}ms)", elapsedMillis(startTime));
            return failure(Health.down(), DYNAMODB_TABLE_NOT_FOUND_MESSAGE, lastChecked, startTime, e);

        } catch (DynamoDbException e) {
            logger.error("Observation store not reachable ({}ms)", elapsedMillis(startTime), e);
            return failure(Health.down(), DYNAMODB_NOT_ACCESSIBLE_MESSAGE, lastChecked, startTime, e);

        } catch (Exception e) {
            logger.error("Unexpected error during observation store health check", e);
            return failure(Health.outOfService(), UNEXPECTED_ERROR_MESSAGE, lastChecked, startTime, e);
        }
    }

    private Health failure(Health.Builder builder, String status, Instant lastChecked, long startTime, Exception e) {
        return builder
                .withDetail(STATUS_KEY, status)
                .withDetail(DATABASE_KEY, DATABASE_TYPE)
                .withDetail(LAST_CHECKED_KEY, lastChecked)
                .withDetail(RESPONSE_TIME_KEY, elapsedMillis(startTime))
                .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
                .build();
    }

    private static long elapsedMillis(long startTime) {
        return (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
    }
}
