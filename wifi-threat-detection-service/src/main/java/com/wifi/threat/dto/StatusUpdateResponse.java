package com.wifi.threat.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateResponse {
    private boolean success;
    private String message;
    private AccessPointRecord network;
}
