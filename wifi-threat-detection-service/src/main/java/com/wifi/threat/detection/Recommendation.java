package com.wifi.threat.detection;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator guidance attached to an assessment.
 *
 * @param general advice keyed by risk level
 * @param specific per-finding tips, never empty
 */
public record Recommendation(
        @JsonProperty("general") String general,
        @JsonProperty("specific") List<String> specific) {}
