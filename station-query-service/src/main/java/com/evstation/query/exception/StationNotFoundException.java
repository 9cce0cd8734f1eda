package com.evstation.query.exception;

/** No latest state exists for the requested station. */
public class StationNotFoundException extends RuntimeException {

  private final String stationId;

  public StationNotFoundException(String stationId) {
    super("Station " + stationId + " not found");
    this.stationId = stationId;
  }

  public String getStationId() {
    return stationId;
  }
}
