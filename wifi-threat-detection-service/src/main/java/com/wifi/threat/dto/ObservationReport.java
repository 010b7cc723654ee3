package com.wifi.threat.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One sensor reading of one access point, as posted by a scanning device.
 *
 * <p>Fields carry no bean validation. A report with a missing BSSID, or one that does not bind
 * (e.g. a non-numeric {@code rssi}), is rejected per item by the intake pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationReport {

    @JsonProperty("ssid")
    private String ssid;

    @JsonProperty("bssid")
    private String bssid;

    /** Signal strength in dBm. */
    @JsonProperty("rssi")
    private Integer rssi;

    @JsonProperty("channel")
    private Integer channel;

    @JsonProperty("encType")
    @JsonAlias("encryptionType")
    private String encType;
}
