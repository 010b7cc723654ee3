package com.wifi.threat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Connection settings for the access point table, bound from {@code aws.dynamodb.*}.
 */
@ConfigurationProperties(prefix = "aws.dynamodb")
@Validated
public record DynamoDbProperties(

    @NotBlank(message = "DynamoDB region is required") String region,

    /** Endpoint override, e.g. DynamoDB Local; blank means the regional AWS endpoint. */
    String endpoint,

    @NotBlank(message = "DynamoDB table name is required") String tableName) {

  public boolean hasEndpointOverride() {
    return endpoint != null && !endpoint.isBlank();
  }
}
