package com.wifi.threat.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Risk level breakdown of a threat report. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThreatSummary {
    private int total;
    private int critical;
    private int high;
    private int medium;
    private int low;
    private int harmful;
}
