package com.evstation.telemetry.ingestion.config;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.config.properties.SqsConfigurationProperties;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

/**
 * AWS SDK v2 configuration for SQS, DynamoDB and S3.
 *
 * <p>Unified configuration that adapts to environment based on application.yml settings. Supports
 * both LocalStack (development) and AWS (production) environments.
 *
 * <p>Queue clients and store clients use separate override configurations: long polling needs a
 * call timeout above the 20 second wait, while every store call is bounded by the ingestion
 * timeouts so that a hung write surfaces as a transient failure.
 */
@Configuration
public class AwsConfiguration {

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  @Value("${aws.endpoint-url:}")
  private String endpointUrl;

  @Value("${aws.credentials.access-key:}")
  private String accessKey;

  @Value("${aws.credentials.secret-key:}")
  private String secretKey;

  /** Override configuration for queue polling and deletion. */
  @Bean
  public ClientOverrideConfiguration queueClientOverrideConfiguration() {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(Duration.ofMinutes(1))
        .apiCallAttemptTimeout(Duration.ofSeconds(30))
        .retryPolicy(
            RetryPolicy.builder()
                .numRetries(3)
                .backoffStrategy(BackoffStrategy.defaultStrategy())
                .build())
        .build();
  }

  /** Override configuration bounding every DynamoDB and S3 write. */
  @Bean
  public ClientOverrideConfiguration storeClientOverrideConfiguration(
      IngestionConfigurationProperties ingestionConfig) {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(ingestionConfig.storeCallTimeout())
        .apiCallAttemptTimeout(ingestionConfig.storeCallAttemptTimeout())
        .retryPolicy(
            RetryPolicy.builder()
                .numRetries(2)
                .backoffStrategy(BackoffStrategy.defaultStrategy())
                .build())
        .build();
  }

  /** Unified AWS credentials provider that adapts to environment. */
  @Bean
  public AwsCredentialsProvider awsCredentialsProvider() {
    // Static credentials for LocalStack
    if (!accessKey.isEmpty() && !secretKey.isEmpty()) {
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }
    return DefaultCredentialsProvider.create();
  }

  @Bean
  public SqsAsyncClient sqsAsyncClient(
      AwsCredentialsProvider credentialsProvider,
      @Qualifier("queueClientOverrideConfiguration") ClientOverrideConfiguration overrideConfiguration) {

    var builder =
        SqsAsyncClient.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(overrideConfiguration);

    if (!endpointUrl.isEmpty()) {
      builder.endpointOverride(URI.create(endpointUrl));
    }

    return builder.build();
  }

  /** Synchronous SQS client for queue URL resolution and health checks. */
  @Bean
  public SqsClient sqsClient(
      AwsCredentialsProvider credentialsProvider,
      @Qualifier("queueClientOverrideConfiguration") ClientOverrideConfiguration overrideConfiguration) {

    var builder =
        SqsClient.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(overrideConfiguration);

    if (!endpointUrl.isEmpty()) {
      builder.endpointOverride(URI.create(endpointUrl));
    }

    return builder.build();
  }

  /**
   * Environment-agnostic SQS queue URL resolver.
   *
   * <ul>
   *   <li>If queue-url is provided: uses it directly (LocalStack compatibility)
   *   <li>If queue-name is provided: looks the URL up through SQS (AWS standard)
   * </ul>
   */
  @Bean
  public String resolvedQueueUrl(SqsClient sqsClient, SqsConfigurationProperties sqsConfig) {
    if (sqsConfig.hasDirectUrl()) {
      return sqsConfig.queueUrl();
    }

    if (sqsConfig.hasQueueName()) {
      try {
        var request = GetQueueUrlRequest.builder().queueName(sqsConfig.queueName()).build();
        return sqsClient.getQueueUrl(request).queueUrl();
      } catch (Exception e) {
        throw new IllegalStateException(
            "Failed to resolve queue URL for queue name: " + sqsConfig.queueName(), e);
      }
    }

    throw new IllegalStateException("Neither queue URL nor queue name is configured");
  }

  @Bean
  public DynamoDbClient dynamoDbClient(
      AwsCredentialsProvider credentialsProvider,
      @Qualifier("storeClientOverrideConfiguration") ClientOverrideConfiguration overrideConfiguration) {

    var builder =
        DynamoDbClient.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(overrideConfiguration);

    if (!endpointUrl.isEmpty()) {
      builder.endpointOverride(URI.create(endpointUrl));
    }

    return builder.build();
  }

  @Bean
  public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
    return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamoDbClient).build();
  }

  @Bean
  public S3Client s3Client(
      AwsCredentialsProvider credentialsProvider,
      @Qualifier("storeClientOverrideConfiguration") ClientOverrideConfiguration overrideConfiguration) {

    var builder =
        S3Client.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(overrideConfiguration);

    if (!endpointUrl.isEmpty()) {
      builder
          .endpointOverride(URI.create(endpointUrl))
          .forcePathStyle(true); // Required for LocalStack
    }

    return builder.build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
