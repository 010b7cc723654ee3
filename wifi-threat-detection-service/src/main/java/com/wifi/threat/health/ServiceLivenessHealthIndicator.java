package com.wifi.threat.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Liveness of the threat detection service. Always UP while the context is running; carries
 * startup time and uptime for operators.
 */
@Component("serviceLiveness")
public class ServiceLivenessHealthIndicator implements HealthIndicator {

    private static final String SERVICE_NAME = "WiFi Threat Detection Service";
    private static final String SERVICE_VERSION = "1.0.0";
    private static final String SERVICE_ALIVE_MESSAGE = "Service is alive and running";

    /** Below this uptime the value is shown in milliseconds. */
    private static final Duration UPTIME_SECONDS_THRESHOLD = Duration.ofSeconds(5);

    private final Clock clock;
    private final Instant startupTime;

    public ServiceLivenessHealthIndicator(Clock clock) {
        this.clock = clock;
        this.startupTime = clock.instant();
    }

    @Override
    public Health health() {
        Duration uptime = Duration.between(startupTime, clock.instant());
        return Health.up()
                .withDetail("status", SERVICE_ALIVE_MESSAGE)
                .withDetail("serviceName", SERVICE_NAME)
                .withDetail("version", SERVICE_VERSION)
                .withDetail("startupTime", startupTime)
                .withDetail("uptime", formatUptime(uptime))
                .build();
    }

    static String formatUptime(Duration uptime) {
        if (uptime.compareTo(UPTIME_SECONDS_THRESHOLD) < 0) {
            return uptime.toMillis() + " ms";
        }
        return String.format(Locale.ROOT, "%.2f seconds", uptime.toMillis() / 1000.0);
    }
}
