package com.wifi.threat.detection;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import lombok.Builder;

/**
 * Immutable pattern, weight and threshold tables used by the detectors.
 *
 * <p>Built once at startup from configuration (see
 * {@link com.wifi.threat.config.ThreatDetectionConfig}); {@link #defaults()} returns the standard
 * tables.
 *
 * <p>Risk classification: {@code score >= criticalThreshold} is critical, {@code >=
 * highThreshold} high, {@code >= mediumThreshold} medium, anything else low. A record is harmful
 * when {@code score >= harmfulThreshold}.
 */
@Builder(toBuilder = true)
public record ThreatRules(
        List<Pattern> suspiciousSsidPatterns,
        List<String> suspiciousMacPrefixes,
        int suspiciousSsidPoints,
        int evilTwinPoints,
        int openNetworkPoints,
        int signalAnomalyPoints,
        int channelCongestionPoints,
        int suspiciousMacPoints,
        int signalHistoryMinimum,
        int signalWindowSize,
        int signalVariationThresholdDbm,
        int highFrequencyThreshold,
        int channelCongestionThreshold,
        int criticalThreshold,
        int highThreshold,
        int mediumThreshold,
        int harmfulThreshold) {

    public static final List<String> DEFAULT_SUSPICIOUS_SSID_PATTERNS = List.of(
            "free.?wifi",
            "guest.?network",
            "open.?wifi",
            "wifi.?free",
            "hotspot",
            "android.?ap",
            "iphone.?hotspot",
            "mobile.?hotspot");

    /** Locally administered, obviously fake, test and sequential OUIs. */
    public static final List<String> DEFAULT_SUSPICIOUS_MAC_PREFIXES = List.of(
            "02:00:00",
            "AA:BB:CC",
            "00:11:22",
            "12:34:56");

    public ThreatRules {
        suspiciousSsidPatterns = List.copyOf(suspiciousSsidPatterns);
        suspiciousMacPrefixes = suspiciousMacPrefixes.stream()
                .map(prefix -> prefix.toUpperCase(Locale.ROOT))
                .toList();
    }

    public static ThreatRules defaults() {
        return ThreatRules.builder()
                .suspiciousSsidPatterns(compile(DEFAULT_SUSPICIOUS_SSID_PATTERNS))
                .suspiciousMacPrefixes(DEFAULT_SUSPICIOUS_MAC_PREFIXES)
                .suspiciousSsidPoints(30)
                .evilTwinPoints(50)
                .openNetworkPoints(25)
                .signalAnomalyPoints(35)
                .channelCongestionPoints(20)
                .suspiciousMacPoints(15)
                .signalHistoryMinimum(5)
                .signalWindowSize(10)
                .signalVariationThresholdDbm(20)
                .highFrequencyThreshold(100)
                .channelCongestionThreshold(15)
                .criticalThreshold(70)
                .highThreshold(40)
                .mediumThreshold(20)
                .harmfulThreshold(40)
                .build();
    }

    /** Compiles SSID patterns as case-insensitive find-anywhere expressions. */
    public static List<Pattern> compile(List<String> expressions) {
        return expressions.stream()
                .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
