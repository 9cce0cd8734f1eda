package com.evstation.telemetry.ingestion.store;

/**
 * Raised by a store writer when a write did not happen. The write may be retried later; nothing
 * was partially applied.
 */
public abstract class StoreWriteException extends RuntimeException {

  private final StoreFailureKind kind;

  protected StoreWriteException(StoreFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public StoreFailureKind kind() {
    return kind;
  }

  /** Wraps a store client failure into the exception matching its kind. */
  public static StoreWriteException of(StoreFailureKind kind, String message, Throwable cause) {
    return kind == StoreFailureKind.CAPACITY_EXCEEDED
        ? new CapacityExceededException(message, cause)
        : new TransientStoreException(message, cause);
  }
}
