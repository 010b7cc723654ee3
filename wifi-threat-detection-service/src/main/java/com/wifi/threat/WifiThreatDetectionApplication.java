package com.wifi.threat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the WiFi Threat Detection Service.
 *
 * <p>Sensor devices post batches of observed access points. Each observation is folded into a
 * per-BSSID record in DynamoDB, assessed against every stored record, and harmful unknown networks
 * are escalated to suspicious. Operators read and curate the records through the dashboard API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.wifi.threat.config")
public class WifiThreatDetectionApplication {

  public static void main(String[] args) {
    SpringApplication.run(WifiThreatDetectionApplication.class, args);
  }
}
