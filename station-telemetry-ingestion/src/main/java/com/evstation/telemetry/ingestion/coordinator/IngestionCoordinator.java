package com.evstation.telemetry.ingestion.coordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.evstation.telemetry.ingestion.archive.ArchiveKeyGenerator;
import com.evstation.telemetry.ingestion.archive.ArchiveWriter;
import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.dto.StationStateRecord;
import com.evstation.telemetry.ingestion.dto.TelemetryEvent;
import com.evstation.telemetry.ingestion.normalization.TelemetryNormalizer;
import com.evstation.telemetry.ingestion.normalization.UnrepresentableNumberException;
import com.evstation.telemetry.ingestion.store.StationStateWriter;
import com.evstation.telemetry.ingestion.store.StoreFailureKind;
import com.evstation.telemetry.ingestion.store.StoreWriteException;
import com.evstation.telemetry.ingestion.validation.RejectionReason;
import com.evstation.telemetry.ingestion.validation.TelemetryValidator;
import com.evstation.telemetry.ingestion.validation.ValidationResult;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Ingests one telemetry event: validate, normalize, write the latest state, append the archive.
 *
 * <p><strong>Write Order:</strong> the state store is always written first. A state failure ends
 * the event without an archive attempt, which favours a fresh latest state over a complete
 * archive. An archive failure after a successful state write is not rolled back; the event ends
 * {@code PARTIALLY_FAILED} with the state ahead of the archive until a later event or an external
 * reconciliation catches up.
 *
 * <p><strong>Delivery:</strong> the coordinator never retries. A redelivered event upserts the
 * same state again and appends a second archive object.
 *
 * <p><strong>Error Handling:</strong> every call returns a terminal {@link IngestionOutcome};
 * no exception escapes for a single bad event.
 *
 * <p>The coordinator keeps no per-event state between calls and may be invoked concurrently.
 * Events of the same station are not ordered: whichever state write lands last wins.
 */
@Service
public class IngestionCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(IngestionCoordinator.class);
  private static final String DEVICE_ID_KEY = "deviceId";

  private final TelemetryValidator validator;
  private final TelemetryNormalizer normalizer;
  private final StationStateWriter stateWriter;
  private final ArchiveWriter archiveWriter;
  private final ArchiveKeyGenerator keyGenerator;
  private final Duration invocationDeadline;
  private final Clock clock;

  private final Map<IngestionOutcome.Status, Counter> outcomeCounters =
      new EnumMap<>(IngestionOutcome.Status.class);
  private final Timer ingestionTimer;

  public IngestionCoordinator(
      TelemetryValidator validator,
      TelemetryNormalizer normalizer,
      StationStateWriter stateWriter,
      ArchiveWriter archiveWriter,
      ArchiveKeyGenerator keyGenerator,
      IngestionConfigurationProperties ingestionConfig,
      Clock clock,
      MeterRegistry meterRegistry) {
    if (stateWriter == null) {
      throw new IllegalArgumentException("StationStateWriter cannot be null");
    }
    if (archiveWriter == null) {
      throw new IllegalArgumentException("ArchiveWriter cannot be null");
    }

    this.validator = validator;
    this.normalizer = normalizer;
    this.stateWriter = stateWriter;
    this.archiveWriter = archiveWriter;
    this.keyGenerator = keyGenerator;
    this.invocationDeadline = ingestionConfig.invocationDeadline();
    this.clock = clock;

    for (IngestionOutcome.Status status : IngestionOutcome.Status.values()) {
      outcomeCounters.put(
          status,
          Counter.builder("ingestion.outcome")
              .description("Telemetry events by terminal ingestion outcome")
              .tag("status", status.name().toLowerCase())
              .register(meterRegistry));
    }
    this.ingestionTimer =
        Timer.builder("ingestion.duration")
            .description("Time taken to ingest one telemetry event")
            .register(meterRegistry);

    logger.info(
        "Ingestion coordinator initialized with invocation deadline {}", invocationDeadline);
  }

  /**
   * Ingests one raw message body.
   *
   * @param rawMessage UTF-8 JSON body as delivered by the transport
   * @return terminal outcome; never {@code null}
   */
  public IngestionOutcome ingest(String rawMessage) {
    Instant received = clock.instant();
    Instant deadline = received.plus(invocationDeadline);
    Timer.Sample sample = Timer.start();

    try {
      IngestionOutcome outcome = run(rawMessage, received, deadline);
      outcomeCounters.get(outcome.status()).increment();
      return outcome;
    } finally {
      sample.stop(ingestionTimer);
      MDC.remove(DEVICE_ID_KEY);
    }
  }

  private IngestionOutcome run(String rawMessage, Instant received, Instant deadline) {
    transition(IngestionState.RECEIVED, IngestionState.VALIDATING, null);
    ValidationResult validation = validator.validate(rawMessage);

    if (!validation.isValid()) {
      transition(IngestionState.VALIDATING, IngestionState.REJECTED, null);
      logger.warn("Rejected telemetry event: {}", validation.rejection().code());
      return IngestionOutcome.rejected(validation.rejection());
    }

    String deviceId = validation.event().deviceId();
    MDC.put(DEVICE_ID_KEY, deviceId);

    TelemetryEvent event;
    try {
      event = normalizer.normalize(validation.event());
    } catch (UnrepresentableNumberException e) {
      RejectionReason reason = RejectionReason.outOfStoreRange(e.getField());
      transition(IngestionState.VALIDATING, IngestionState.REJECTED, deviceId);
      logger.warn("Rejected telemetry event: {} ({})", reason.code(), e.getMessage());
      return IngestionOutcome.rejected(reason);
    }
    transition(IngestionState.VALIDATING, IngestionState.VALIDATED, deviceId);

    if (deadlinePassed(deadline)) {
      return deadlineExceeded(deviceId, false, IngestionState.VALIDATED);
    }

    transition(IngestionState.VALIDATED, IngestionState.WRITING_STATE, deviceId);
    try {
      stateWriter.upsert(toStateRecord(event, received));
    } catch (StoreWriteException e) {
      transition(IngestionState.WRITING_STATE, IngestionState.PARTIALLY_FAILED, deviceId);
      logger.error(
          "State write failed for station {} ({}), archive not attempted: {}",
          deviceId,
          e.kind().code(),
          e.getMessage());
      return IngestionOutcome.partiallyFailed(deviceId, false, e.kind(), e.getMessage());
    } catch (RuntimeException e) {
      transition(IngestionState.WRITING_STATE, IngestionState.PARTIALLY_FAILED, deviceId);
      logger.error("Unexpected state write failure for station {}", deviceId, e);
      return IngestionOutcome.partiallyFailed(
          deviceId, false, StoreFailureKind.TRANSIENT_UNAVAILABLE, e.getMessage());
    }

    if (deadlinePassed(deadline)) {
      return deadlineExceeded(deviceId, true, IngestionState.WRITING_STATE);
    }

    transition(IngestionState.WRITING_STATE, IngestionState.WRITING_ARCHIVE, deviceId);
    String archiveKey = keyGenerator.keyFor(event);
    try {
      archiveWriter.append(archiveKey, normalizer.toArchiveBytes(event), deviceId);
    } catch (StoreWriteException e) {
      transition(IngestionState.WRITING_ARCHIVE, IngestionState.PARTIALLY_FAILED, deviceId);
      logger.warn(
          "Partial success for station {}: state=true, archive=false ({}): {}",
          deviceId,
          e.kind().code(),
          e.getMessage());
      return IngestionOutcome.partiallyFailed(deviceId, true, e.kind(), e.getMessage());
    } catch (RuntimeException e) {
      transition(IngestionState.WRITING_ARCHIVE, IngestionState.PARTIALLY_FAILED, deviceId);
      logger.error("Unexpected archive failure for station {}", deviceId, e);
      return IngestionOutcome.partiallyFailed(
          deviceId, true, StoreFailureKind.TRANSIENT_UNAVAILABLE, e.getMessage());
    }

    transition(IngestionState.WRITING_ARCHIVE, IngestionState.COMPLETED, deviceId);
    logger.info("Processed telemetry for station {}, archived as {}", deviceId, archiveKey);
    return IngestionOutcome.completed(deviceId, archiveKey);
  }

  private boolean deadlinePassed(Instant deadline) {
    return !clock.instant().isBefore(deadline);
  }

  private IngestionOutcome deadlineExceeded(
      String deviceId, boolean stateWritten, IngestionState from) {
    transition(from, IngestionState.PARTIALLY_FAILED, deviceId);
    String detail = "Invocation deadline of " + invocationDeadline + " exceeded";
    logger.warn(
        "{} for station {}: state={}, archive=false", detail, deviceId, stateWritten);
    return IngestionOutcome.partiallyFailed(
        deviceId, stateWritten, StoreFailureKind.TRANSIENT_UNAVAILABLE, detail);
  }

  private static StationStateRecord toStateRecord(TelemetryEvent event, Instant received) {
    return StationStateRecord.builder()
        .deviceId(event.deviceId())
        .batteryAvailable(event.batteryAvailable())
        .batteryCharging(event.batteryCharging())
        .temperature(event.temperature())
        .humidity(event.humidity())
        .status(event.status().wireValue())
        .timestamp(event.timestamp().toString())
        .totalSwapsToday(event.totalSwapsToday())
        .lastSwapTime(event.lastSwapTime() != null ? event.lastSwapTime().toString() : null)
        .lastUpdated(received.toString())
        .build();
  }

  private static void transition(IngestionState from, IngestionState to, String deviceId) {
    logger.debug("Event {} -> {} (station {})", from, to, deviceId);
  }
}
