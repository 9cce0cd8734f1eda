package com.evstation.query.config;

import java.net.URI;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import com.evstation.query.config.properties.StationTableProperties;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Configuration
@EnableConfigurationProperties(StationTableProperties.class)
public class DynamoDBConfig {

  @Value("${aws.dynamodb.endpoint:}")
  private String dynamoDbEndpoint;

  @Value("${aws.dynamodb.region:us-east-1}")
  private String region;

  @Bean
  @Profile("local")
  public DynamoDbClient localDynamoDbClient() {
    // LocalStack or DynamoDB Local
    return DynamoDbClient.builder()
        .endpointOverride(URI.create(dynamoDbEndpoint))
        .region(Region.of(region))
        .credentialsProvider(
            StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
        .build();
  }

  @Bean
  @Profile("!local")
  public DynamoDbClient awsDynamoDbClient() {
    // Default credential provider chain, e.g. the execution role
    if (dynamoDbEndpoint != null && !dynamoDbEndpoint.isEmpty()) {
      return DynamoDbClient.builder()
          .endpointOverride(URI.create(dynamoDbEndpoint))
          .region(Region.of(region))
          .build();
    }
    return DynamoDbClient.builder().region(Region.of(region)).build();
  }

  @Bean
  public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
    return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamoDbClient).build();
  }
}
