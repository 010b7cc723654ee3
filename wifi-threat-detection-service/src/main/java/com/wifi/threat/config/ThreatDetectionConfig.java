package com.wifi.threat.config;

import java.time.Clock;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wifi.threat.detection.ThreatRules;

/**
 * Wires the detector tables and the service clock.
 */
@Configuration
public class ThreatDetectionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ThreatDetectionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreatRules threatRules(ThreatDetectionProperties properties) {
        ThreatRules rules = applyOverrides(ThreatRules.defaults(), properties.rules());
        logger.info("Loaded threat rules: {} SSID patterns, {} MAC prefixes, congestion threshold {}",
                rules.suspiciousSsidPatterns().size(),
                rules.suspiciousMacPrefixes().size(),
                rules.channelCongestionThreshold());
        return rules;
    }

    static ThreatRules applyOverrides(ThreatRules defaults, ThreatDetectionProperties.Rules overrides) {
        if (overrides == null) {
            return defaults;
        }

        ThreatRules.ThreatRulesBuilder builder = defaults.toBuilder();
        if (overrides.suspiciousSsidPatterns() != null && !overrides.suspiciousSsidPatterns().isEmpty()) {
            builder.suspiciousSsidPatterns(ThreatRules.compile(overrides.suspiciousSsidPatterns()));
        }
        if (overrides.suspiciousMacPrefixes() != null && !overrides.suspiciousMacPrefixes().isEmpty()) {
            builder.suspiciousMacPrefixes(overrides.suspiciousMacPrefixes());
        }

        override(overrides.suspiciousSsidPoints(), builder::suspiciousSsidPoints);
        override(overrides.evilTwinPoints(), builder::evilTwinPoints);
        override(overrides.openNetworkPoints(), builder::openNetworkPoints);
        override(overrides.signalAnomalyPoints(), builder::signalAnomalyPoints);
        override(overrides.channelCongestionPoints(), builder::channelCongestionPoints);
        override(overrides.suspiciousMacPoints(), builder::suspiciousMacPoints);

        override(overrides.signalHistoryMinimum(), builder::signalHistoryMinimum);
        override(overrides.signalWindowSize(), builder::signalWindowSize);
        override(overrides.signalVariationThresholdDbm(), builder::signalVariationThresholdDbm);
        override(overrides.highFrequencyThreshold(), builder::highFrequencyThreshold);
        override(overrides.channelCongestionThreshold(), builder::channelCongestionThreshold);

        override(overrides.criticalThreshold(), builder::criticalThreshold);
        override(overrides.highThreshold(), builder::highThreshold);
        override(overrides.mediumThreshold(), builder::mediumThreshold);
        override(overrides.harmfulThreshold(), builder::harmfulThreshold);

        ThreatRules rules = builder.build();
        if (rules.criticalThreshold() <= rules.highThreshold() || rules.highThreshold() <= rules.mediumThreshold()) {
            throw new IllegalStateException(String.format(
                    "Risk thresholds must descend: critical %d, high %d, medium %d",
                    rules.criticalThreshold(), rules.highThreshold(), rules.mediumThreshold()));
        }
        return rules;
    }

    private static void override(Integer value, IntConsumer setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
