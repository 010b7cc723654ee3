package com.wifi.threat.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.wifi.threat.config.DynamoDbProperties;
import com.wifi.threat.dto.AccessPointRecord;
import com.wifi.threat.exception.ConcurrentUpdateException;
import com.wifi.threat.exception.ObservationStoreException;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.DescribeTableEnhancedResponse;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.InternalServerErrorException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

/**
 * Unit tests for AccessPointRepositoryImpl: error translation, versioned writes and health checks.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AccessPointRepository DynamoDB Tests")
class AccessPointRepositoryImplTest {

    private static final String TEST_TABLE_NAME = "test_wifi_access_points";
    private static final String BSSID = "F4:F2:6D:01:02:03";
    private static final long TEST_ITEM_COUNT = 42L;

    @Mock
    private DynamoDbEnhancedClient mockEnhancedClient;

    @Mock
    private DynamoDbTable<AccessPointRecord> mockTable;

    @Mock
    private PageIterable<AccessPointRecord> mockScanPages;

    @Mock
    private DescribeTableEnhancedResponse mockDescribeResponse;

    @Mock
    private TableDescription mockTableDescription;

    private AccessPointRepositoryImpl repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        when(mockEnhancedClient.table(eq(TEST_TABLE_NAME), any(TableSchema.class))).thenReturn(mockTable);
        repository = new AccessPointRepositoryImpl(mockEnhancedClient,
                new DynamoDbProperties("us-east-1", null, TEST_TABLE_NAME));
    }

    private static AccessPointRecord storedRecord(long version) {
        return AccessPointRecord.builder()
                .bssid(BSSID)
                .ssid("HomeNet")
                .observationCount(4L)
                .status("unknown")
                .version(version)
                .build();
    }

    @Test
    void should_ReturnRecord_When_KeyExists() {
        AccessPointRecord stored = storedRecord(4L);
        when(mockTable.getItem(any(GetItemEnhancedRequest.class))).thenReturn(stored);

        Optional<AccessPointRecord> found = repository.findByBssid(BSSID);

        assertTrue(found.isPresent());
        assertSame(stored, found.get());
    }

    @Test
    void should_ReadKeyConsistently_When_LookingUpBssid() {
        when(mockTable.getItem(any(GetItemEnhancedRequest.class))).thenReturn(storedRecord(4L));

        repository.findByBssid(BSSID);

        ArgumentCaptor<GetItemEnhancedRequest> captor = ArgumentCaptor.forClass(GetItemEnhancedRequest.class);
        verify(mockTable).getItem(captor.capture());
        assertEquals(Boolean.TRUE, captor.getValue().consistentRead());
        assertEquals(BSSID, captor.getValue().key().partitionKeyValue().s());
    }

    @Test
    void should_ScanConsistently_When_LoadingAllRecords() {
        AccessPointRecord stored = storedRecord(4L);
        when(mockTable.scan(any(ScanEnhancedRequest.class))).thenReturn(mockScanPages);
        when(mockScanPages.items()).thenReturn(() -> List.of(stored).iterator());

        List<AccessPointRecord> records = repository.findAll();

        assertEquals(List.of(stored), records);
        ArgumentCaptor<ScanEnhancedRequest> captor = ArgumentCaptor.forClass(ScanEnhancedRequest.class);
        verify(mockTable).scan(captor.capture());
        assertEquals(Boolean.TRUE, captor.getValue().consistentRead());
    }

    @Test
    void should_ReturnEmpty_When_KeyAbsent() {
        when(mockTable.getItem(any(GetItemEnhancedRequest.class))).thenReturn(null);

        assertFalse(repository.findByBssid(BSSID).isPresent());
    }

    @Test
    void should_WrapSdkFailure_When_ReadFails() {
        when(mockTable.getItem(any(GetItemEnhancedRequest.class)))
                .thenThrow(InternalServerErrorException.builder().message("Internal error").build());

        ObservationStoreException thrown =
                assertThrows(ObservationStoreException.class, () -> repository.findByBssid(BSSID));
        assertEquals("Failed to retrieve access point " + BSSID, thrown.getMessage());
    }

    @Test
    void should_ReturnWrittenRecord_When_VersionMatches() {
        AccessPointRecord written = storedRecord(5L);
        when(mockTable.updateItem(any(AccessPointRecord.class))).thenReturn(written);

        AccessPointRecord result = repository.save(storedRecord(4L));

        assertEquals(5L, result.getVersion());
    }

    @Test
    void should_ThrowConcurrentUpdate_When_VersionConditionFails() {
        when(mockTable.updateItem(any(AccessPointRecord.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("The conditional request failed").build());

        assertThrows(ConcurrentUpdateException.class, () -> repository.save(storedRecord(4L)));
    }

    @Test
    void should_ThrowStoreException_When_WriteFailsOtherwise() {
        when(mockTable.updateItem(any(AccessPointRecord.class)))
                .thenThrow(InternalServerErrorException.builder().message("Internal error").build());

        assertThrows(ObservationStoreException.class, () -> repository.save(storedRecord(4L)));
    }

    @Test
    @DisplayName("Upsert re-reads and retries after a version conflict")
    void should_RetryReadModifyWrite_When_FirstWriteConflicts() {
        when(mockTable.getItem(any(GetItemEnhancedRequest.class))).thenReturn(storedRecord(4L), storedRecord(5L));
        when(mockTable.updateItem(any(AccessPointRecord.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("conflict").build())
                .thenReturn(storedRecord(6L));

        AccessPointRecord result = repository.upsert(BSSID, current -> {
            AccessPointRecord record = current.orElseThrow();
            record.setObservationCount(record.getObservationCount() + 1);
            return record;
        }, 3);

        assertEquals(6L, result.getVersion());
        verify(mockTable, times(2)).getItem(any(GetItemEnhancedRequest.class));
        verify(mockTable, times(2)).updateItem(any(AccessPointRecord.class));
    }

    @Test
    void should_GiveUp_When_EveryAttemptConflicts() {
        when(mockTable.getItem(any(GetItemEnhancedRequest.class))).thenReturn(storedRecord(4L));
        when(mockTable.updateItem(any(AccessPointRecord.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("conflict").build());

        ConcurrentUpdateException thrown = assertThrows(ConcurrentUpdateException.class,
                () -> repository.upsert(BSSID, current -> current.orElseThrow(), 3));

        assertEquals("Record " + BSSID + " kept changing after 3 attempts", thrown.getMessage());
        verify(mockTable, times(3)).updateItem(any(AccessPointRecord.class));
    }

    @Test
    void should_ReturnHealthyResult_When_TableAccessible() {
        when(mockTable.describeTable()).thenReturn(mockDescribeResponse);
        when(mockDescribeResponse.table()).thenReturn(mockTableDescription);
        when(mockTableDescription.itemCount()).thenReturn(TEST_ITEM_COUNT);

        AccessPointRepository.HealthCheckResult result = repository.validateTableHealth();

        assertTrue(result.isHealthy());
        assertEquals(TEST_TABLE_NAME, result.tableName());
        assertEquals(TEST_ITEM_COUNT, result.itemCount());
        assertEquals("Table is accessible and healthy", result.statusMessage());
    }

    @Test
    void should_PropagateResourceNotFound_When_TableMissing() {
        when(mockTable.describeTable())
                .thenThrow(ResourceNotFoundException.builder().message("Table not found").build());

        assertThrows(ResourceNotFoundException.class, () -> repository.validateTableHealth());
    }
}
