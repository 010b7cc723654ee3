package com.wifi.threat.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Batch of observation reports submitted by one sensor device. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanBatchRequest {

    /** Reporting device; the configured default device id is used when absent. */
    @JsonProperty("deviceId")
    private String deviceId;

    /**
     * Raw reports. Each element is bound to {@link ObservationReport} during intake so one
     * malformed entry fails on its own instead of rejecting the batch.
     */
    @JsonProperty("networks")
    private List<JsonNode> networks;
}
