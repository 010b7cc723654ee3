package com.wifi.threat.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Threat counters for one ingested batch. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SecuritySummary {
    private int threatsDetected;
    private int criticalThreats;
    private int highThreats;
    private int harmfulNetworks;
}
