package com.evstation.telemetry.ingestion.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

/** Readiness check for the latest-state table. */
@Component("stateTable")
public class StateTableHealthIndicator implements HealthIndicator {

  private static final Logger logger = LoggerFactory.getLogger(StateTableHealthIndicator.class);

  private static final String DATABASE_TYPE = "DynamoDB";
  private static final String TABLE_ACTIVE = "ACTIVE";

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  public StateTableHealthIndicator(
      DynamoDbClient dynamoDbClient, IngestionConfigurationProperties ingestionConfig) {
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = ingestionConfig.stateTableName();
  }

  @Override
  public Health health() {
    long start = System.nanoTime();
    try {
      TableDescription table =
          dynamoDbClient
              .describeTable(DescribeTableRequest.builder().tableName(tableName).build())
              .table();
      long responseTimeMs = (System.nanoTime() - start) / 1_000_000;
      String status = table.tableStatusAsString();

      Health.Builder builder = TABLE_ACTIVE.equals(status) ? Health.up() : Health.down();
      return builder
          .withDetail("database", DATABASE_TYPE)
          .withDetail("tableName", tableName)
          .withDetail("tableStatus", status)
          .withDetail("responseTimeMs", responseTimeMs)
          .build();

    } catch (ResourceNotFoundException e) {
      logger.warn("State table {} not found", tableName);
      return Health.down()
          .withDetail("database", DATABASE_TYPE)
          .withDetail("tableName", tableName)
          .withDetail("error", "DynamoDB table not found")
          .build();
    } catch (DynamoDbException e) {
      logger.warn("State table {} is not accessible: {}", tableName, e.getMessage());
      return Health.down()
          .withDetail("database", DATABASE_TYPE)
          .withDetail("tableName", tableName)
          .withDetail("error", String.valueOf(e.getMessage()))
          .build();
    } catch (Exception e) {
      logger.error("Unexpected error during state table health check", e);
      return Health.outOfService()
          .withDetail("database", DATABASE_TYPE)
          .withDetail("tableName", tableName)
          .withDetail("error", String.valueOf(e.getMessage()))
          .build();
    }
  }
}
