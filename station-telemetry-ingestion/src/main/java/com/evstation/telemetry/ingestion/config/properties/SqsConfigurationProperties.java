package com.evstation.telemetry.ingestion.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the telemetry SQS queue.
 *
 * <p>Either {@code queueUrl} (LocalStack) or {@code queueName} (AWS) must be configured.
 */
@ConfigurationProperties(prefix = "sqs")
@Validated
public record SqsConfigurationProperties(
    String queueUrl,
    String queueName,
    @NotNull(message = "Max messages is required")
        @Min(value = 1, message = "Max messages must be at least 1")
        @Max(value = 10, message = "Max messages cannot exceed 10")
        Integer maxMessages,
    @NotNull(message = "Wait time seconds is required")
        @Min(value = 0, message = "Wait time seconds cannot be negative")
        @Max(value = 20, message = "Wait time seconds cannot exceed 20")
        Integer waitTimeSeconds,
    @NotNull(message = "Visibility timeout seconds is required")
        @Min(value = 30, message = "Visibility timeout must be at least 30 seconds")
        @Max(value = 43200, message = "Visibility timeout cannot exceed 12 hours")
        Integer visibilityTimeoutSeconds) {

  public boolean hasDirectUrl() {
    return queueUrl != null && !queueUrl.isBlank();
  }

  public boolean hasQueueName() {
    return queueName != null && !queueName.isBlank();
  }

  @AssertTrue(message = "Either sqs.queue-url or sqs.queue-name must be configured")
  public boolean isQueueConfigured() {
    return hasDirectUrl() || hasQueueName();
  }
}
