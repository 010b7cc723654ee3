package com.wifi.threat.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkListResponse {
    private boolean success;
    private int count;
    private List<AccessPointRecord> networks;
}
