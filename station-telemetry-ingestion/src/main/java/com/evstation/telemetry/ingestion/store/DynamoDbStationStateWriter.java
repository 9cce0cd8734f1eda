package com.evstation.telemetry.ingestion.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.dto.StationStateRecord;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

/**
 * DynamoDB implementation of the latest-state store.
 *
 * <p>Uses a plain {@code PutItem} without condition expression, which DynamoDB applies atomically
 * per key. Call duration is bounded by the store client's override configuration; a timeout
 * surfaces as a transient failure.
 */
@Repository
public class DynamoDbStationStateWriter implements StationStateWriter {

  private static final Logger logger = LoggerFactory.getLogger(DynamoDbStationStateWriter.class);

  private final DynamoDbTable<StationStateRecord> table;
  private final StoreExceptionClassifier exceptionClassifier;

  public DynamoDbStationStateWriter(
      DynamoDbEnhancedClient enhancedClient,
      IngestionConfigurationProperties ingestionConfig,
      StoreExceptionClassifier exceptionClassifier) {
    this(
        enhancedClient.table(
            ingestionConfig.stateTableName(), TableSchema.fromBean(StationStateRecord.class)),
        exceptionClassifier);
    logger.info("State store writer initialized for table {}", ingestionConfig.stateTableName());
  }

  DynamoDbStationStateWriter(
      DynamoDbTable<StationStateRecord> table, StoreExceptionClassifier exceptionClassifier) {
    this.table = table;
    this.exceptionClassifier = exceptionClassifier;
  }

  @Override
  public void upsert(StationStateRecord record) {
    try {
      table.putItem(record);
      logger.debug("Stored state for station {} in table {}", record.getDeviceId(), table.tableName());
    } catch (SdkException e) {
      StoreFailureKind kind = exceptionClassifier.classify(e);
      throw StoreWriteException.of(
          kind,
          "Failed to store state for station " + record.getDeviceId() + ": " + e.getMessage(),
          e);
    }
  }
}
