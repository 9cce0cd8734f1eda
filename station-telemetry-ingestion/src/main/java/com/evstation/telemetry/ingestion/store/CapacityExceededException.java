package com.evstation.telemetry.ingestion.store;

/** The store throttled the request. */
public class CapacityExceededException extends StoreWriteException {

  public CapacityExceededException(String message, Throwable cause) {
    super(StoreFailureKind.CAPACITY_EXCEEDED, message, cause);
  }
}
