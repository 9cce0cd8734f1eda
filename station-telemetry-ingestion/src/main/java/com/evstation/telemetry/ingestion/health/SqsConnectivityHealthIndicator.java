package com.evstation.telemetry.ingestion.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.evstation.telemetry.ingestion.listener.SqsMessageReceiver;
import com.evstation.telemetry.ingestion.service.SqsMonitoringService;

/**
 * Health indicator for SQS connectivity.
 *
 * <p>Only marks the service DOWN when the queue cannot be reached or the receiver loop is not
 * running. Ingestion outcomes are reported as details and never affect the status: a burst of
 * rejected or partially failed events is an operational concern, not an outage.
 */
@Component("sqsConnectivity")
public class SqsConnectivityHealthIndicator implements HealthIndicator {

  private static final Logger logger =
      LoggerFactory.getLogger(SqsConnectivityHealthIndicator.class);

  private final SqsMonitoringService sqsMonitoringService;
  private final SqsMessageReceiver messageReceiver;
  private final String queueUrl;

  public SqsConnectivityHealthIndicator(
      SqsMonitoringService sqsMonitoringService,
      SqsMessageReceiver messageReceiver,
      @Value("#{@resolvedQueueUrl}") String queueUrl) {
    this.sqsMonitoringService = sqsMonitoringService;
    this.messageReceiver = messageReceiver;
    this.queueUrl = queueUrl;
  }

  @Override
  public Health health() {
    try {
      boolean connected = sqsMonitoringService.isQueueConnected();
      boolean receiving = messageReceiver.isRunning();
      SqsMonitoringService.SqsMetrics metrics = sqsMonitoringService.getMetrics();

      Health.Builder builder = connected && receiving ? Health.up() : Health.down();
      return builder
          .withDetail("connected", connected)
          .withDetail("receiverRunning", receiving)
          .withDetail("queueUrl", queueUrl)
          .withDetail("totalMessagesReceived", metrics.totalMessagesReceived())
          .withDetail("totalCompleted", metrics.totalCompleted())
          .withDetail("totalPartiallyFailed", metrics.totalPartiallyFailed())
          .withDetail("totalRejected", metrics.totalRejected())
          .withDetail("completionRate", metrics.completionRate())
          .withDetail(
              "lastSuccessfulConnection",
              metrics.lastSuccessfulConnection() != null
                  ? metrics.lastSuccessfulConnection().toString()
                  : "Never")
          .withDetail("consecutiveConnectionFailures", metrics.consecutiveConnectionFailures())
          .withDetail("timeSinceLastMessageMs", describeIdle(sqsMonitoringService))
          .build();

    } catch (Exception e) {
      logger.error("SQS connectivity check failed", e);
      return Health.down()
          .withDetail("connected", false)
          .withDetail("queueUrl", queueUrl)
          .withDetail("error", String.valueOf(e.getMessage()))
          .withDetail("errorType", e.getClass().getSimpleName())
          .build();
    }
  }

  /** Idle time of the queue, or {@code Never} before the first non-empty batch. */
  private static Object describeIdle(SqsMonitoringService monitoringService) {
    long idleMillis = monitoringService.getTimeSinceLastMessageReceived();
    return idleMillis == Long.MAX_VALUE ? "Never" : idleMillis;
  }
}
