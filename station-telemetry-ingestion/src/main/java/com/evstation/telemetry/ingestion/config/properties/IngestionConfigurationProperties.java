package com.evstation.telemetry.ingestion.config.properties;

import java.time.Duration;

import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Settings of the ingestion pipeline: where the two stores live and how long a single event may
 * take.
 *
 * <p>One instance is bound at start-up and handed to the AWS clients and the coordinator; nothing
 * reads these values from the environment afterwards.
 *
 * @param stateTableName DynamoDB table holding one latest-state item per device
 * @param archiveBucketName S3 bucket receiving one archive object per accepted event
 * @param archivePrefix top-level key prefix of archive objects
 * @param storeCallTimeout upper bound of a single store call, retries included; all three
 *     durations must be positive
 * @param storeCallAttemptTimeout upper bound of one HTTP attempt of a store call
 * @param invocationDeadline time budget of one event, from receipt to the archive write
 * @param redeliverPartialFailures leave partially failed messages on the queue for redelivery
 */
@ConfigurationProperties(prefix = "ingestion")
@Validated
public record IngestionConfigurationProperties(
    @NotBlank(message = "State table name is required") String stateTableName,
    @NotBlank(message = "Archive bucket name is required") String archiveBucketName,
    @DefaultValue("telemetry") String archivePrefix,
    @NotNull @DurationMin(millis = 1) @DefaultValue("10s") Duration storeCallTimeout,
    @NotNull @DurationMin(millis = 1) @DefaultValue("3s") Duration storeCallAttemptTimeout,
    @NotNull @DurationMin(millis = 1) @DefaultValue("30s") Duration invocationDeadline,
    @DefaultValue("false") boolean redeliverPartialFailures) {}
