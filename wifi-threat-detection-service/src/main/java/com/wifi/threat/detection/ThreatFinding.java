package com.wifi.threat.detection;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One triggered detector.
 *
 * @param type kind of threat
 * @param severity severity of this finding on its own
 * @param description short operator-facing summary
 * @param details supporting explanation
 */
public record ThreatFinding(
        @JsonProperty("type") ThreatType type,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("description") String description,
        @JsonProperty("details") String details) {}
