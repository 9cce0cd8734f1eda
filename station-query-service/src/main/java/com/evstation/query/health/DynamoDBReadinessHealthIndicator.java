package com.evstation.query.health;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.evstation.query.repository.StationStateRepository;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Readiness of the latest-state table.
 *
 * <ul>
 *   <li>UP when the repository reports an active table
 *   <li>DOWN when the table is missing, not active or unreachable
 *   <li>OUT_OF_SERVICE for unexpected errors
 * </ul>
 */
@Component("dynamoDBReadiness")
public class DynamoDBReadinessHealthIndicator implements HealthIndicator {

  private static final Logger logger =
      LoggerFactory.getLogger(DynamoDBReadinessHealthIndicator.class);

  private static final String DATABASE_TYPE = "DynamoDB";

  private static final String DYNAMODB_ACCESSIBLE_MESSAGE = "DynamoDB is accessible";
  private static final String DYNAMODB_NOT_ACCESSIBLE_MESSAGE = "DynamoDB is not accessible";
  private static final String DYNAMODB_TABLE_NOT_FOUND_MESSAGE = "DynamoDB table not found";
  private static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error during health check";

  private static final String STATUS_KEY = "status";
  private static final String DATABASE_KEY = "database";
  private static final String TABLE_NAME_KEY = "tableName";
  private static final String LAST_CHECKED_KEY = "lastChecked";
  private static final String RESPONSE_TIME_KEY = "responseTimeMs";
  private static final String ITEM_COUNT_KEY = "itemCount";
  private static final String ERROR_KEY = "error";

  private final StationStateRepository repository;

  public DynamoDBReadinessHealthIndicator(StationStateRepository repository) {
    this.repository = repository;
  }

  @Override
  public Health health() {
    Instant lastChecked = Instant.now();

    try {
      StationStateRepository.HealthCheckResult result = repository.validateTableHealth();
      Health.Builder builder = result.isHealthy() ? Health.up() : Health.down();
      if (!result.isHealthy()) {
        logger.warn("State table {} not ready: {}", result.tableName(), result.statusMessage());
      }

      return builder
          .withDetail(
              STATUS_KEY, result.isHealthy() ? DYNAMODB_ACCESSIBLE_MESSAGE : result.statusMessage())
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(TABLE_NAME_KEY, result.tableName())
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .withDetail(RESPONSE_TIME_KEY, result.responseTimeMs())
          .withDetail(ITEM_COUNT_KEY, result.itemCount())
          .build();

    } catch (ResourceNotFoundException e) {
      logger.warn("DynamoDB table not found during readiness check");
      return Health.down()
          .withDetail(STATUS_KEY, DYNAMODB_TABLE_NOT_FOUND_MESSAGE)
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
          .build();

    } catch (DynamoDbException e) {
      logger.error("DynamoDB connection error during readiness check", e);
      return Health.down()
          .withDetail(STATUS_KEY, DYNAMODB_NOT_ACCESSIBLE_MESSAGE)
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
          .build();

    } catch (Exception e) {
      logger.error("Unexpected error during readiness check", e);
      return Health.outOfService()
          .withDetail(STATUS_KEY, UNEXPECTED_ERROR_MESSAGE)
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
          .build();
    }
  }
}
