package com.wifi.threat.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

/**
 * Observed state of one physical access point, keyed by its upper-case BSSID.
 *
 * <p>The record is created on the first observation of a BSSID and refreshed on every later one.
 * Encryption type and status are stored as their wire labels so the table stays readable from
 * other tooling; {@link #encryption()} and {@link #accessPointStatus()} give the typed views.
 *
 * <p>{@code version} is the optimistic locking attribute maintained by the DynamoDB enhanced
 * client. It is internal and never serialized to API clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@DynamoDbBean
public class AccessPointRecord {

    public static final String HIDDEN_NETWORK_SSID = "Hidden Network";

    private String bssid;
    private String ssid;
    private Integer rssi;
    private Integer channel;
    private String encryptionType;
    private Instant firstSeen;
    private Instant lastSeen;
    private Long observationCount;
    @Builder.Default
    private List<SignalSample> history = new ArrayList<>();
    private String status;
    private String sourceDeviceId;
    @JsonIgnore
    private Long version;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("bssid")
    public String getBssid() {
        return bssid;
    }

    @DynamoDbAttribute("ssid")
    public String getSsid() {
        return ssid;
    }

    @DynamoDbAttribute("encryption_type")
    public String getEncryptionType() {
        return encryptionType;
    }

    @DynamoDbAttribute("first_seen")
    public Instant getFirstSeen() {
        return firstSeen;
    }

    @DynamoDbAttribute("last_seen")
    public Instant getLastSeen() {
        return lastSeen;
    }

    @DynamoDbAttribute("observation_count")
    public Long getObservationCount() {
        return observationCount;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "StatusIndex")
    @DynamoDbAttribute("status")
    public String getStatus() {
        return status;
    }

    @DynamoDbAttribute("source_device_id")
    public String getSourceDeviceId() {
        return sourceDeviceId;
    }

    @JsonIgnore
    @DynamoDbVersionAttribute
    @DynamoDbAttribute("version")
    public Long getVersion() {
        return version;
    }

    /** Typed view of the stored encryption label. */
    public EncryptionType encryption() {
        return EncryptionType.fromLabel(encryptionType);
    }

    /** Typed view of the stored status; unrecognised values read as {@code unknown}. */
    public AccessPointStatus accessPointStatus() {
        return AccessPointStatus.fromValue(status).orElse(AccessPointStatus.UNKNOWN);
    }

    /**
     * Appends a reading, evicting the oldest entries so that at most {@code limit} remain.
     */
    public void appendSample(SignalSample sample, int limit) {
        List<SignalSample> updated = history == null ? new ArrayList<>() : new ArrayList<>(history);
        updated.add(sample);
        if (updated.size() > limit) {
            updated = new ArrayList<>(updated.subList(updated.size() - limit, updated.size()));
        }
        this.history = updated;
    }

    /** Copy with its own history list, safe to mutate independently of this record. */
    public AccessPointRecord copy() {
        List<SignalSample> samples = new ArrayList<>();
        if (history != null) {
            history.forEach(s -> samples.add(new SignalSample(s.getRssi(), s.getTimestamp())));
        }
        return toBuilder().history(samples).build();
    }
}
