package com.wifi.threat.detection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds operator guidance from a risk level and the findings that produced it.
 */
public final class RecommendationBuilder {

    static final String FALLBACK_TIP = "Follow standard WiFi security practices";

    private static final Map<RiskLevel, String> GENERAL_ADVICE = new EnumMap<>(Map.of(
            RiskLevel.CRITICAL,
            "IMMEDIATE ACTION REQUIRED: Block this network and investigate immediately. High probability of malicious activity.",
            RiskLevel.HIGH,
            "CAUTION: Avoid connecting to this network. Monitor closely and consider blocking.",
            RiskLevel.MEDIUM,
            "WARNING: Exercise caution. Verify network legitimacy before connecting.",
            RiskLevel.LOW,
            "INFO: Minor security concerns detected. Standard security practices recommended."));

    private static final Map<ThreatType, String> TIPS = new EnumMap<>(Map.of(
            ThreatType.EVIL_TWIN, "Verify with network administrator which is the legitimate network",
            ThreatType.OPEN_NETWORK, "Use VPN if connection is necessary",
            ThreatType.SUSPICIOUS_SSID, "Verify network legitimacy with venue staff",
            ThreatType.SIGNAL_ANOMALY, "Monitor for deauth attacks or jamming attempts"));

    private RecommendationBuilder() {
    }

    public static Recommendation build(RiskLevel riskLevel, List<ThreatFinding> findings) {
        List<String> specific = new ArrayList<>();
        for (ThreatFinding finding : findings) {
            String tip = TIPS.get(finding.type());
            if (tip != null) {
                specific.add(tip);
            }
        }
        if (specific.isEmpty()) {
            specific.add(FALLBACK_TIP);
        }
        return new Recommendation(GENERAL_ADVICE.get(riskLevel), List.copyOf(specific));
    }
}
