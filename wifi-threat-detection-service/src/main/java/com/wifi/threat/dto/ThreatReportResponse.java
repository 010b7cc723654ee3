package com.wifi.threat.dto;

import java.util.List;

import com.wifi.threat.detection.ThreatAssessment;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThreatReportResponse {
    private boolean success;
    private ThreatSummary summary;
    private List<ThreatAssessment> threats;
}
