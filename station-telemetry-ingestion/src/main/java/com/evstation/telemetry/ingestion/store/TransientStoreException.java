package com.evstation.telemetry.ingestion.store;

/** The store timed out or could not be reached. */
public class TransientStoreException extends StoreWriteException {

  public TransientStoreException(String message, Throwable cause) {
    super(StoreFailureKind.TRANSIENT_UNAVAILABLE, message, cause);
  }
}
