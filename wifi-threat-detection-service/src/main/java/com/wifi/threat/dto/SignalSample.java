package com.wifi.threat.dto;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/** One signal strength reading in an access point's bounded history. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class SignalSample {

    private Integer rssi;
    private Instant timestamp;

    @DynamoDbAttribute("rssi")
    public Integer getRssi() {
        return rssi;
    }

    @DynamoDbAttribute("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }
}
