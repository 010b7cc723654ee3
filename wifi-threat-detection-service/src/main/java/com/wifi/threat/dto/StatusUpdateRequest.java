package com.wifi.threat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manual status change submitted by an operator. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    @JsonProperty("status")
    private String status;
}
