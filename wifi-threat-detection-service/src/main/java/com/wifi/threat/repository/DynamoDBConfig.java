package com.wifi.threat.repository;

import java.net.URI;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

import com.wifi.threat.config.DynamoDbProperties;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * DynamoDB clients for the access point store.
 *
 * <p>Outside the {@code local} profile credentials come from the default provider chain. The
 * {@code local} profile targets DynamoDB Local, which accepts any static credentials.
 */
@Configuration
@Profile("!test")
@Slf4j
public class DynamoDBConfig {

    static final String LOCAL_PROFILE = "local";

    @Bean
    public DynamoDbClient dynamoDbClient(DynamoDbProperties properties, Environment environment) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(properties.region()));

        if (properties.hasEndpointOverride()) {
            builder.endpointOverride(URI.create(properties.endpoint()));
        }
        if (environment.acceptsProfiles(Profiles.of(LOCAL_PROFILE))) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create("local", "local")));
        }

        log.info("DynamoDB client for table {} in {} (endpoint: {})", properties.tableName(),
                properties.region(), properties.hasEndpointOverride() ? properties.endpoint() : "default");
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }
}
