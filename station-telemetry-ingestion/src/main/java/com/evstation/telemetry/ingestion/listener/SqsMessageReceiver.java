package com.evstation.telemetry.ingestion.listener;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.config.properties.SqsConfigurationProperties;
import com.evstation.telemetry.ingestion.coordinator.IngestionOutcome;
import com.evstation.telemetry.ingestion.processor.MessageProcessingResult;
import com.evstation.telemetry.ingestion.processor.MessageProcessor;
import com.evstation.telemetry.ingestion.service.SqsMonitoringService;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

/**
 * Long-polling SQS receiver feeding telemetry messages to the ingestion coordinator.
 *
 * <p><strong>Processing Loop:</strong>
 *
 * <ol>
 *   <li>Long-poll the queue for a batch of up to {@code sqs.max-messages} messages
 *   <li>Ingest each message independently; one bad message never affects the rest of the batch
 *   <li>Batch-delete the messages whose outcome is final
 * </ol>
 *
 * <p>Rejected messages are deleted because they would fail again on every delivery. Partially
 * failed messages are deleted as well unless {@code ingestion.redeliver-partial-failures} is set,
 * in which case they reappear after the visibility timeout and are ingested again. A redelivery
 * repeats both writes: the state upsert is idempotent, the archive gains a second object.
 */
@Service
public class SqsMessageReceiver {

  private static final Logger logger = LoggerFactory.getLogger(SqsMessageReceiver.class);
  private static final String CORRELATION_ID_KEY = "correlationId";
  private static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

  private final SqsAsyncClient sqsAsyncClient;
  private final SqsConfigurationProperties sqsConfig;
  private final MessageProcessor messageProcessor;
  private final SqsMonitoringService sqsMonitoringService;
  private final boolean redeliverPartialFailures;
  private final String queueUrl;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private final Timer batchReceiveTimer;

  public SqsMessageReceiver(
      SqsAsyncClient sqsAsyncClient,
      SqsConfigurationProperties sqsConfig,
      IngestionConfigurationProperties ingestionConfig,
      MessageProcessor messageProcessor,
      SqsMonitoringService sqsMonitoringService,
      MeterRegistry meterRegistry,
      @Value("#{@resolvedQueueUrl}") String queueUrl) {
    if (sqsAsyncClient == null) {
      throw new IllegalArgumentException("SqsAsyncClient cannot be null");
    }
    if (messageProcessor == null) {
      throw new IllegalArgumentException("MessageProcessor cannot be null");
    }

    this.sqsAsyncClient = sqsAsyncClient;
    this.sqsConfig = sqsConfig;
    this.messageProcessor = messageProcessor;
    this.sqsMonitoringService = sqsMonitoringService;
    this.redeliverPartialFailures = ingestionConfig.redeliverPartialFailures();
    this.queueUrl = queueUrl;

    this.batchReceiveTimer =
        Timer.builder("sqs.batch.receive.duration")
            .description("Time taken to receive SQS message batches")
            .register(meterRegistry);
  }

  @PostConstruct
  public void start() {
    if (running.compareAndSet(false, true)) {
      logger.info(
          "Starting SQS message receiver: queueUrl={}, maxMessages={}, waitTimeSeconds={}, "
              + "redeliverPartialFailures={}",
          queueUrl,
          sqsConfig.maxMessages(),
          sqsConfig.waitTimeSeconds(),
          redeliverPartialFailures);
      receiveMessagesLoop();
    }
  }

  @PreDestroy
  public void stop() {
    if (running.compareAndSet(true, false)) {
      logger.info("Stopping SQS message receiver");
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  private void receiveMessagesLoop() {
    ReceiveMessageRequest receiveMessageRequest =
        ReceiveMessageRequest.builder()
            .queueUrl(queueUrl)
            .maxNumberOfMessages(sqsConfig.maxMessages())
            .waitTimeSeconds(sqsConfig.waitTimeSeconds())
            .visibilityTimeout(sqsConfig.visibilityTimeoutSeconds())
            .build();

    CompletableFuture.runAsync(
            () -> {
              while (running.get()) {
                try {
                  pullMessagesWith(receiveMessageRequest);
                } catch (Exception e) {
                  logger.error("Error in SQS message receiving loop", e);
                  try {
                    Thread.sleep(ERROR_BACKOFF.toMillis());
                  } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("SQS message receiver interrupted");
                    break;
                  }
                }
              }
            })
        .exceptionally(
            throwable -> {
              logger.error("Fatal error in SQS message receiver", throwable);
              return null;
            });
  }

  void pullMessagesWith(ReceiveMessageRequest receiveMessageRequest) {
    String correlationId = UUID.randomUUID().toString();
    MDC.put(CORRELATION_ID_KEY, correlationId);

    try {
      Timer.Sample receiveSample = Timer.start();
      sqsAsyncClient
          .receiveMessage(receiveMessageRequest)
          .thenAccept(response -> process(response, receiveSample, correlationId))
          .exceptionally(handleError(receiveSample))
          .join();
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }

  private Function<Throwable, Void> handleError(Timer.Sample receiveSample) {
    return throwable -> {
      receiveSample.stop(batchReceiveTimer);
      logger.error("Failed to receive messages from SQS queue", throwable);
      return null;
    };
  }

  private void process(
      ReceiveMessageResponse response, Timer.Sample receiveSample, String correlationId) {
    try {
      receiveSample.stop(batchReceiveTimer);
      MDC.put(CORRELATION_ID_KEY, correlationId);

      List<Message> messages = response.messages();
      if (messages.isEmpty()) {
        logger.debug("No messages received from SQS queue");
        return;
      }

      logger.info("Received {} messages from SQS queue", messages.size());
      sqsMonitoringService.recordMessagesReceived(messages.size());

      List<MessageProcessingResult> results =
          messages.stream().map(this::processMessage).flatMap(Optional::stream).toList();

      List<MessageProcessingResult> toDelete =
          results.stream().filter(r -> r.shouldDelete(redeliverPartialFailures)).toList();

      buildDeleteRequest(toDelete).ifPresent(this::deleteBatch);
      logBatchResults(messages.size(), results, toDelete.size());
    } catch (Exception e) {
      logger.error("Error processing message batch", e);
    } finally {
      MDC.remove(CORRELATION_ID_KEY);
    }
  }

  /** Empty when the processor itself failed; such a message stays on the queue. */
  private Optional<MessageProcessingResult> processMessage(Message message) {
    try {
      MessageProcessingResult result = messageProcessor.processMessage(message);
      sqsMonitoringService.recordOutcome(result.outcome());
      return Optional.of(result);
    } catch (Exception e) {
      logger.error(
          "Error processing SQS message {}, leaving it for redelivery", message.messageId(), e);
      return Optional.empty();
    }
  }

  private Optional<DeleteMessageBatchRequest> buildDeleteRequest(
      List<MessageProcessingResult> results) {
    if (results.isEmpty()) {
      return Optional.empty();
    }
    List<DeleteMessageBatchRequestEntry> entries =
        results.stream()
            .map(
                result ->
                    DeleteMessageBatchRequestEntry.builder()
                        .id(result.messageId())
                        .receiptHandle(result.receiptHandle())
                        .build())
            .toList();
    return Optional.of(
        DeleteMessageBatchRequest.builder().queueUrl(queueUrl).entries(entries).build());
  }

  private void deleteBatch(DeleteMessageBatchRequest deleteRequest) {
    try {
      sqsAsyncClient
          .deleteMessageBatch(deleteRequest)
          .thenAccept(
              response -> {
                List<BatchResultErrorEntry> failed = response.failed();
                if (!failed.isEmpty()) {
                  logger.warn("Failed to delete {} messages from batch", failed.size());
                  failed.forEach(
                      error ->
                          logger.warn(
                              "Delete failed for message: {} - {}", error.id(), error.message()));
                }
                logger.debug(
                    "Batch delete completed: {} deleted, {} failed",
                    response.successful().size(),
                    failed.size());
              })
          .exceptionally(
              throwable -> {
                logger.error("Failed to delete message batch", throwable);
                return null;
              })
          .join();
    } catch (Exception e) {
      logger.error("Error deleting message batch", e);
    }
  }

  private void logBatchResults(
      int batchSize, List<MessageProcessingResult> results, int deletedCount) {
    long completed =
        results.stream().filter(r -> r.outcome().status() == IngestionOutcome.Status.COMPLETED).count();
    long rejected =
        results.stream().filter(r -> r.outcome().status() == IngestionOutcome.Status.REJECTED).count();
    long partial = results.size() - completed - rejected;

    logger.info(
        "Batch processed: size={}, completed={}, partiallyFailed={}, rejected={}, "
            + "processorErrors={}, deleted={}",
        batchSize,
        completed,
        partial,
        rejected,
        batchSize - results.size(),
        deletedCount);
  }
}
