package com.evstation.telemetry.ingestion.store;

/** Failure categories shared by the state store and the archive store. */
public enum StoreFailureKind {
  CAPACITY_EXCEEDED("capacity-exceeded"),
  TRANSIENT_UNAVAILABLE("transient-unavailable");

  private final String code;

  StoreFailureKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
