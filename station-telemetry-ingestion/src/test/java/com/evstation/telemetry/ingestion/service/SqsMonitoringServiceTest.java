package com.evstation.telemetry.ingestion.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.evstation.telemetry.ingestion.coordinator.IngestionOutcome;
import com.evstation.telemetry.ingestion.store.StoreFailureKind;
import com.evstation.telemetry.ingestion.support.MutableClock;
import com.evstation.telemetry.ingestion.validation.RejectionReason;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.SqsException;

@ExtendWith(MockitoExtension.class)
class SqsMonitoringServiceTest {

  @Mock private SqsClient sqsClient;

  private static final Instant START = Instant.parse("2024-01-15T14:23:45Z");

  private MutableClock clock;
  private SqsMonitoringService monitoringService;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    monitoringService =
        new SqsMonitoringService(sqsClient, "http://localhost:4566/000000000000/q", clock);
  }

  @Test
  void isQueueConnected_AttributesReadable_ReturnsTrue() {
    // Given
    when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
        .thenReturn(GetQueueAttributesResponse.builder().build());

    // When / Then
    assertThat(monitoringService.isQueueConnected()).isTrue();
    assertThat(monitoringService.getMetrics().lastSuccessfulConnection()).isEqualTo(START);
    assertThat(monitoringService.getMetrics().consecutiveConnectionFailures()).isZero();
  }

  @Test
  void isQueueConnected_SqsError_ReturnsFalseAndCountsFailure() {
    // Given
    when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
        .thenThrow(SqsException.builder().message("denied").build());

    // When
    boolean first = monitoringService.isQueueConnected();
    boolean second = monitoringService.isQueueConnected();

    // Then
    assertThat(first).isFalse();
    assertThat(second).isFalse();
    assertThat(monitoringService.getMetrics().consecutiveConnectionFailures()).isEqualTo(2);
  }

  @Test
  void recordOutcome_MixedOutcomes_AreCountedByStatus() {
    // When
    monitoringService.recordMessagesReceived(4);
    monitoringService.recordOutcome(IngestionOutcome.completed("station-01", "k1"));
    monitoringService.recordOutcome(IngestionOutcome.completed("station-02", "k2"));
    monitoringService.recordOutcome(
        IngestionOutcome.partiallyFailed(
            "station-03", true, StoreFailureKind.TRANSIENT_UNAVAILABLE, "timeout"));
    monitoringService.recordOutcome(
        IngestionOutcome.rejected(RejectionReason.missingField("timestamp")));

    // Then
    SqsMonitoringService.SqsMetrics metrics = monitoringService.getMetrics();
    assertThat(metrics.totalMessagesReceived()).isEqualTo(4);
    assertThat(metrics.totalCompleted()).isEqualTo(2);
    assertThat(metrics.totalPartiallyFailed()).isEqualTo(1);
    assertThat(metrics.totalRejected()).isEqualTo(1);
    assertThat(metrics.totalProcessed()).isEqualTo(4);
    assertThat(metrics.completionRate()).isEqualTo(0.5);
    assertThat(monitoringService.getTimeSinceLastMessageReceived()).isZero();
  }

  @Test
  void getTimeSinceLastMessageReceived_MeasuresFromLastBatch() {
    // Given
    monitoringService.recordMessagesReceived(3);

    // When
    clock.advance(Duration.ofSeconds(90));

    // Then
    assertThat(monitoringService.getTimeSinceLastMessageReceived()).isEqualTo(90_000L);
  }

  @Test
  void getMetrics_NothingProcessed_ReportsFullCompletionRate() {
    assertThat(monitoringService.getMetrics().completionRate()).isEqualTo(1.0);
    assertThat(monitoringService.getTimeSinceLastMessageReceived()).isEqualTo(Long.MAX_VALUE);
  }
}
