package com.evstation.query.repository.impl;

import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import com.evstation.query.config.properties.StationTableProperties;
import com.evstation.query.dto.StationState;
import com.evstation.query.repository.StationStateRepository;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

/**
 * DynamoDB implementation of {@link StationStateRepository}.
 *
 * <p>The station list is a full table scan. The enhanced client's page iterable requests the
 * next page for as long as DynamoDB returns a {@code LastEvaluatedKey}, so tables larger than
 * one scan page (1 MB) are returned completely.
 */
@Slf4j
@Repository
public class DynamoDbStationStateRepository implements StationStateRepository {

  private static final String TABLE_ACTIVE = "ACTIVE";
  private static final long NANOS_TO_MILLIS = 1_000_000L;

  private final DynamoDbTable<StationState> table;

  @Autowired
  public DynamoDbStationStateRepository(
      DynamoDbEnhancedClient enhancedClient, StationTableProperties tableProperties) {
    this(
        enhancedClient.table(
            tableProperties.tableName(), TableSchema.fromBean(StationState.class)));
  }

  DynamoDbStationStateRepository(DynamoDbTable<StationState> table) {
    this.table = table;
  }

  @Override
  public List<StationState> findAll() {
    List<StationState> stations = table.scan().items().stream().toList();
    log.debug("Scanned {} stations from table {}", stations.size(), table.tableName());
    return stations;
  }

  @Override
  public Optional<StationState> findByDeviceId(String deviceId) {
    if (deviceId == null || deviceId.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(table.getItem(Key.builder().partitionValue(deviceId).build()));
  }

  @Override
  public HealthCheckResult validateTableHealth() {
    long start = System.nanoTime();
    TableDescription description = table.describeTable().table();
    long responseTimeMs = (System.nanoTime() - start) / NANOS_TO_MILLIS;

    String status = description.tableStatusAsString();
    long itemCount = description.itemCount() != null ? description.itemCount() : 0L;
    boolean healthy = TABLE_ACTIVE.equals(status);

    return new HealthCheckResult(
        healthy,
        responseTimeMs,
        table.tableName(),
        itemCount,
        healthy ? "Table is active" : "Table status is " + status);
  }
}
