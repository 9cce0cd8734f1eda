package com.evstation.telemetry.ingestion.coordinator;

/**
 * Lifecycle of one event inside the coordinator.
 *
 * <pre>
 * RECEIVED -> VALIDATING -> VALIDATED | REJECTED
 * VALIDATED -> WRITING_STATE -> WRITING_ARCHIVE -> COMPLETED | PARTIALLY_FAILED
 * WRITING_STATE -> PARTIALLY_FAILED (state failure, archive never attempted)
 * </pre>
 */
public enum IngestionState {
  RECEIVED,
  VALIDATING,
  VALIDATED,
  REJECTED,
  WRITING_STATE,
  WRITING_ARCHIVE,
  COMPLETED,
  PARTIALLY_FAILED
}
