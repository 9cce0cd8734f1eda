package com.evstation.query.repository;

import java.util.List;
import java.util.Optional;

import com.evstation.query.dto.StationState;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Read access to the latest-state table.
 *
 * <p>Implementations must not cache: every call reflects the table at the time of the call.
 */
public interface StationStateRepository {

  /**
   * Reads every station, following the store's pagination until the last page.
   *
   * @return all stored states; empty when no station has reported yet
   */
  List<StationState> findAll();

  /**
   * Reads the state of one station.
   *
   * @param deviceId station identifier, e.g. {@code station-01}
   * @return the state, or empty if the station never reported
   */
  Optional<StationState> findByDeviceId(String deviceId);

  /**
   * Checks that the table exists and answers.
   *
   * @return health check result with response time and approximate item count
   * @throws ResourceNotFoundException if the table does not exist
   * @throws DynamoDbException if DynamoDB cannot be reached
   */
  HealthCheckResult validateTableHealth();

  /** Outcome of a table health check. */
  record HealthCheckResult(
      boolean isHealthy,
      long responseTimeMs,
      String tableName,
      long itemCount,
      String statusMessage) {}
}
