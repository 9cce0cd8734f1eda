package com.evstation.query.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Location of the latest-state table written by the ingestion service.
 *
 * @param tableName DynamoDB table keyed by {@code device_id}
 */
@ConfigurationProperties(prefix = "stations")
@Validated
public record StationTableProperties(
    @NotBlank(message = "Station state table name is required") String tableName) {}
