package com.evstation.telemetry.ingestion.processor;

import com.evstation.telemetry.ingestion.coordinator.IngestionOutcome;

/**
 * Processing result for a single message, containing the ingestion outcome and receipt handle.
 *
 * @param messageId the SQS message id
 * @param outcome terminal ingestion outcome of the message body
 * @param receiptHandle the SQS receipt handle for message deletion
 */
public record MessageProcessingResult(
    String messageId, IngestionOutcome outcome, String receiptHandle) {

  /**
   * Decides whether the message leaves the queue.
   *
   * <p>Completed and rejected messages are always deleted: the former are done and the latter
   * would fail again. Partially failed messages are deleted unless redelivery is enabled, in which
   * case they become visible again after the visibility timeout.
   *
   * @param redeliverPartialFailures keep partially failed messages on the queue
   */
  public boolean shouldDelete(boolean redeliverPartialFailures) {
    return !(redeliverPartialFailures && outcome.isPartiallyFailed());
  }
}
