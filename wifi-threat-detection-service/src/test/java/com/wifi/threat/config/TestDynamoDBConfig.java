package com.wifi.threat.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import com.wifi.threat.repository.AccessPointRepository;
import com.wifi.threat.repository.impl.InMemoryAccessPointRepository;

/**
 * Test configuration that provides an in-memory repository
 * to avoid DynamoDB dependency in tests.
 */
@TestConfiguration
@Profile("test")
public class TestDynamoDBConfig {

    @Bean
    @Primary
    public AccessPointRepository accessPointRepository() {
        return new InMemoryAccessPointRepository();
    }
}
