package com.evstation.telemetry.ingestion.dto;

import java.util.Arrays;
import java.util.Optional;

/** Operational status reported by a battery swap station. */
public enum StationStatus {
  OPERATIONAL("operational"),
  MAINTENANCE("maintenance"),
  OFFLINE("offline");

  private final String wireValue;

  StationStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * Looks up a status by its wire representation. Matching is exact; {@code "Operational"} is not
   * a known status.
   */
  public static Optional<StationStatus> fromWireValue(String value) {
    return Arrays.stream(values()).filter(s -> s.wireValue.equals(value)).findFirst();
  }
}
