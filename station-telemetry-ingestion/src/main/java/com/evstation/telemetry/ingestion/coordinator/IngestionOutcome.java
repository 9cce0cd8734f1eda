package com.evstation.telemetry.ingestion.coordinator;

import com.evstation.telemetry.ingestion.store.StoreFailureKind;
import com.evstation.telemetry.ingestion.validation.RejectionReason;

/**
 * Terminal result of ingesting one event.
 *
 * <p>{@code PARTIALLY_FAILED} covers both dual-write failure shapes:
 *
 * <ul>
 *   <li>{@code stateWritten=false, archiveWritten=false}: the state write failed and the archive
 *       was not attempted
 *   <li>{@code stateWritten=true, archiveWritten=false}: the state holds the new event, the archive
 *       does not
 * </ul>
 *
 * @param status terminal status
 * @param deviceId station of the event, {@code null} for rejected messages
 * @param stateWritten whether the latest-state upsert succeeded
 * @param archiveWritten whether the archive append succeeded
 * @param failureKind store failure behind a partial failure, otherwise {@code null}
 * @param rejectionReason schema violation behind a rejection, otherwise {@code null}
 * @param archiveKey key of the archive object, set only when it was written
 * @param detail human readable failure description, {@code null} on success
 */
public record IngestionOutcome(
    Status status,
    String deviceId,
    boolean stateWritten,
    boolean archiveWritten,
    StoreFailureKind failureKind,
    RejectionReason rejectionReason,
    String archiveKey,
    String detail) {

  public enum Status {
    COMPLETED,
    PARTIALLY_FAILED,
    REJECTED
  }

  public static IngestionOutcome completed(String deviceId, String archiveKey) {
    return new IngestionOutcome(
        Status.COMPLETED, deviceId, true, true, null, null, archiveKey, null);
  }

  public static IngestionOutcome partiallyFailed(
      String deviceId, boolean stateWritten, StoreFailureKind failureKind, String detail) {
    return new IngestionOutcome(
        Status.PARTIALLY_FAILED, deviceId, stateWritten, false, failureKind, null, null, detail);
  }

  public static IngestionOutcome rejected(RejectionReason reason) {
    return new IngestionOutcome(
        Status.REJECTED, null, false, false, null, reason, null, reason.code());
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  public boolean isPartiallyFailed() {
    return status == Status.PARTIALLY_FAILED;
  }

  public boolean isRejected() {
    return status == Status.REJECTED;
  }
}
