package com.evstation.telemetry.ingestion.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.evstation.telemetry.ingestion.coordinator.IngestionCoordinator;
import com.evstation.telemetry.ingestion.coordinator.IngestionOutcome;

import software.amazon.awssdk.services.sqs.model.Message;

/**
 * Hands the body of an SQS message to the ingestion coordinator.
 *
 * <p>The IoT rule forwards the MQTT payload unchanged, so the message body is the telemetry JSON
 * itself. This class is stateless and thread-safe.
 */
@Service
public class MessageProcessor {

  private static final Logger logger = LoggerFactory.getLogger(MessageProcessor.class);

  private final IngestionCoordinator coordinator;

  public MessageProcessor(IngestionCoordinator coordinator) {
    if (coordinator == null) {
      throw new IllegalArgumentException("IngestionCoordinator cannot be null");
    }
    this.coordinator = coordinator;
  }

  /**
   * Processes a single SQS message containing one telemetry event.
   *
   * @param message the SQS message
   * @return the outcome together with the receipt handle
   */
  public MessageProcessingResult processMessage(Message message) {
    String messageId = message.messageId();
    logger.debug("Processing SQS message: messageId={}", messageId);

    IngestionOutcome outcome = coordinator.ingest(message.body());

    switch (outcome.status()) {
      case COMPLETED -> logger.debug("Message {} completed", messageId);
      case REJECTED ->
          logger.warn(
              "Message {} rejected ({}), dropping it", messageId, outcome.rejectionReason());
      case PARTIALLY_FAILED ->
          logger.warn(
              "Message {} partially failed for station {}: state={}, archive={}, kind={}",
              messageId,
              outcome.deviceId(),
              outcome.stateWritten(),
              outcome.archiveWritten(),
              outcome.failureKind().code());
    }

    return new MessageProcessingResult(messageId, outcome, message.receiptHandle());
  }
}
