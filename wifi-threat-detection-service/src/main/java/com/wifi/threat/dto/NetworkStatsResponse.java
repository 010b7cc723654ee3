package com.wifi.threat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkStatsResponse {
    private boolean success;
    private NetworkStats stats;
}
