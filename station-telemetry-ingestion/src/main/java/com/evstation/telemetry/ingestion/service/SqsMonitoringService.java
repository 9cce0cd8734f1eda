package com.evstation.telemetry.ingestion.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.evstation.telemetry.ingestion.coordinator.IngestionOutcome;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.SqsException;

/**
 * Tracks queue connectivity and message processing activity for health reporting.
 *
 * <p><strong>Activity Tracking:</strong>
 *
 * <ul>
 *   <li>Messages received from the queue
 *   <li>Messages by ingestion outcome (completed, partially failed, rejected)
 *   <li>Last message received timestamp for idle period detection
 * </ul>
 */
@Service
public class SqsMonitoringService {

  private static final Logger logger = LoggerFactory.getLogger(SqsMonitoringService.class);

  private final SqsClient sqsClient;
  private final String queueUrl;
  private final Clock clock;

  private final AtomicReference<Instant> lastMessageReceivedTime = new AtomicReference<>(null);
  private final AtomicLong totalMessagesReceived = new AtomicLong(0);
  private final AtomicLong totalCompleted = new AtomicLong(0);
  private final AtomicLong totalPartiallyFailed = new AtomicLong(0);
  private final AtomicLong totalRejected = new AtomicLong(0);

  private final AtomicReference<Instant> lastSuccessfulConnection = new AtomicReference<>(null);
  private final AtomicLong consecutiveConnectionFailures = new AtomicLong(0);

  public SqsMonitoringService(
      SqsClient sqsClient, @Value("#{@resolvedQueueUrl}") String queueUrl, Clock clock) {
    this.sqsClient = sqsClient;
    this.queueUrl = queueUrl;
    this.clock = clock;
  }

  /**
   * Checks if the SQS client can successfully reach the queue.
   *
   * @return true if the queue attributes could be read, false otherwise
   */
  public boolean isQueueConnected() {
    try {
      GetQueueAttributesRequest request =
          GetQueueAttributesRequest.builder()
              .queueUrl(queueUrl)
              .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
              .build();

      sqsClient.getQueueAttributes(request);
      lastSuccessfulConnection.set(clock.instant());
      consecutiveConnectionFailures.set(0);
      return true;

    } catch (SqsException e) {
      logger.warn("SQS connection check failed: {}", e.getMessage());
      consecutiveConnectionFailures.incrementAndGet();
      return false;
    } catch (Exception e) {
      logger.error("Unexpected error during SQS connection check", e);
      consecutiveConnectionFailures.incrementAndGet();
      return false;
    }
  }

  public void recordMessagesReceived(int count) {
    totalMessagesReceived.addAndGet(count);
    lastMessageReceivedTime.set(clock.instant());
  }

  public void recordOutcome(IngestionOutcome outcome) {
    switch (outcome.status()) {
      case COMPLETED -> totalCompleted.incrementAndGet();
      case PARTIALLY_FAILED -> totalPartiallyFailed.incrementAndGet();
      case REJECTED -> totalRejected.incrementAndGet();
    }
  }

  /** Milliseconds since the last non-empty batch, or {@code Long.MAX_VALUE} if none yet. */
  public long getTimeSinceLastMessageReceived() {
    Instant lastReceived = lastMessageReceivedTime.get();
    return lastReceived != null
        ? Duration.between(lastReceived, clock.instant()).toMillis()
        : Long.MAX_VALUE;
  }

  public SqsMetrics getMetrics() {
    return new SqsMetrics(
        totalMessagesReceived.get(),
        totalCompleted.get(),
        totalPartiallyFailed.get(),
        totalRejected.get(),
        lastSuccessfulConnection.get(),
        consecutiveConnectionFailures.get());
  }

  /** Snapshot of the monitoring counters. */
  public record SqsMetrics(
      long totalMessagesReceived,
      long totalCompleted,
      long totalPartiallyFailed,
      long totalRejected,
      Instant lastSuccessfulConnection,
      long consecutiveConnectionFailures) {

    public long totalProcessed() {
      return totalCompleted + totalPartiallyFailed + totalRejected;
    }

    /** Share of processed messages that completed both writes, 1.0 before the first message. */
    public double completionRate() {
      long processed = totalProcessed();
      return processed == 0 ? 1.0 : (double) totalCompleted / processed;
    }
  }
}
