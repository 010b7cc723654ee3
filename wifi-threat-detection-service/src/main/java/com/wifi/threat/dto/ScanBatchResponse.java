package com.wifi.threat.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response to a sensor batch submission. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanBatchResponse {
    private boolean success;
    private String message;
    private SecuritySummary securitySummary;
    private int processed;
    private int created;
    private int updated;
    private List<ThreatAlert> threats;
    private List<String> errors;
}
