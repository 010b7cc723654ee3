package com.wifi.threat.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for observation intake and threat detection.
 *
 * <p>Detector tables under {@code rules} are optional; any entry left unset keeps the standard
 * value from {@link com.wifi.threat.detection.ThreatRules#defaults()}.
 */
@ConfigurationProperties(prefix = "threat-detection")
@Validated
public record ThreatDetectionProperties(

    /** Shared secret expected in the {@code x-api-key} or {@code Authorization} header. */
    @NotBlank(message = "API key is required") String apiKey,

    /** Device id recorded when a batch does not name its sensor. */
    @NotBlank(message = "Default device id is required") String defaultDeviceId,

    /** Maximum number of signal samples kept per access point. */
    @Min(value = 1, message = "History limit must be at least 1")
        @Max(value = 1000, message = "History limit cannot exceed 1000")
        int historyLimit,

    /** Trailing window in which a record counts as recently active. */
    @NotNull(message = "Recently active window is required") Duration recentlyActiveWindow,

    /** Read-modify-write attempts per record before a version conflict is reported. */
    @Min(value = 1, message = "Upsert attempts must be at least 1")
        @Max(value = 10, message = "Upsert attempts should not exceed 10")
        int upsertMaxAttempts,

    @NestedConfigurationProperty @Valid Rules rules) {

  /**
   * Optional overrides for the detector tables. Points and thresholds left null keep their
   * standard values.
   */
  public record Rules(
      List<String> suspiciousSsidPatterns,
      List<String> suspiciousMacPrefixes,
      @Min(value = 0, message = "Suspicious SSID points cannot be negative") Integer suspiciousSsidPoints,
      @Min(value = 0, message = "Evil twin points cannot be negative") Integer evilTwinPoints,
      @Min(value = 0, message = "Open network points cannot be negative") Integer openNetworkPoints,
      @Min(value = 0, message = "Signal anomaly points cannot be negative") Integer signalAnomalyPoints,
      @Min(value = 0, message = "Channel congestion points cannot be negative") Integer channelCongestionPoints,
      @Min(value = 0, message = "Suspicious MAC points cannot be negative") Integer suspiciousMacPoints,
      @Min(value = 2, message = "Signal history minimum must be at least 2") Integer signalHistoryMinimum,
      @Min(value = 2, message = "Signal window size must be at least 2") Integer signalWindowSize,
      @Min(value = 1, message = "Signal variation threshold must be at least 1 dBm")
          Integer signalVariationThresholdDbm,
      @Min(value = 1, message = "High frequency threshold must be at least 1")
          Integer highFrequencyThreshold,
      @Min(value = 1, message = "Channel congestion threshold must be at least 1")
          Integer channelCongestionThreshold,
      @Min(value = 1, message = "Critical threshold must be at least 1") Integer criticalThreshold,
      @Min(value = 1, message = "High threshold must be at least 1") Integer highThreshold,
      @Min(value = 1, message = "Medium threshold must be at least 1") Integer mediumThreshold,
      @Min(value = 1, message = "Harmful threshold must be at least 1") Integer harmfulThreshold) {}
}
