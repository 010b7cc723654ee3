package com.wifi.threat.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.wifi.threat.repository.AccessPointRepository;

import software.amazon.awssdk.services.dynamodb.model.InternalServerErrorException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
@DisplayName("DynamoDB Readiness Health Indicator Tests")
class DynamoDBReadinessHealthIndicatorTest {

    private static final String TEST_TABLE_NAME = "test_wifi_access_points";
    private static final long TEST_ITEM_COUNT = 250L;

    @Mock
    private AccessPointRepository mockRepository;

    private DynamoDBReadinessHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new DynamoDBReadinessHealthIndicator(mockRepository);
    }

    @Test
    void should_ReturnUpStatus_When_RepositoryHealthy() {
        // Arrange
        when(mockRepository.validateTableHealth()).thenReturn(new AccessPointRepository.HealthCheckResult(
                true, 12L, TEST_TABLE_NAME, TEST_ITEM_COUNT, "Table is accessible and healthy"));

        // Act
        Health health = healthIndicator.health();

        // Assert
        assertEquals(Status.UP, health.getStatus());
        assertEquals("DynamoDB is accessible", health.getDetails().get("status"));
        assertEquals(TEST_TABLE_NAME, health.getDetails().get("tableName"));
        assertEquals(TEST_ITEM_COUNT, health.getDetails().get("itemCount"));
        assertNotNull(health.getDetails().get("lastChecked"));
        verify(mockRepository).validateTableHealth();
    }

    @Test
    void should_ReturnDownStatus_When_RepositorySlow() {
        when(mockRepository.validateTableHealth()).thenReturn(new AccessPointRepository.HealthCheckResult(
                false, 1500L, TEST_TABLE_NAME, TEST_ITEM_COUNT, "Table response time exceeds threshold"));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Table response time exceeds threshold", health.getDetails().get("status"));
    }

    @Test
    void should_ReturnDownStatus_When_TableNotFound() {
        when(mockRepository.validateTableHealth())
                .thenThrow(ResourceNotFoundException.builder().message("Table not found").build());

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DynamoDB table not found", health.getDetails().get("status"));
    }

    @Test
    void should_ReturnDownStatus_When_DynamoDbUnreachable() {
        when(mockRepository.validateTableHealth())
                .thenThrow(InternalServerErrorException.builder().message("Internal error").build());

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DynamoDB is not accessible", health.getDetails().get("status"));
    }

    @Test
    void should_ReturnOutOfService_When_UnexpectedError() {
        when(mockRepository.validateTableHealth()).thenThrow(new IllegalStateException("boom"));

        Health health = healthIndicator.health();

        assertEquals(Status.OUT_OF_SERVICE, health.getStatus());
        assertEquals("boom", health.getDetails().get("error"));
    }
}
