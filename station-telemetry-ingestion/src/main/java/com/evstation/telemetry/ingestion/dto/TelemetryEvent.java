package com.evstation.telemetry.ingestion.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One telemetry reading published by a station.
 *
 * <p>Instances are only created by the validator, so every required field is present and of the
 * right type. Values are not range-checked: a negative battery count or an implausible temperature
 * is carried as reported.
 *
 * @param deviceId non-blank station identifier, e.g. {@code station-01}
 * @param batteryAvailable batteries ready for swapping
 * @param batteryCharging batteries currently charging
 * @param temperature ambient temperature in degrees Celsius
 * @param humidity relative humidity in percent
 * @param status operational status
 * @param timestamp time of the reading (UTC)
 * @param totalSwapsToday swaps performed today, {@code null} when not reported
 * @param lastSwapTime time of the last swap, {@code null} when not reported
 */
public record TelemetryEvent(
    String deviceId,
    int batteryAvailable,
    int batteryCharging,
    BigDecimal temperature,
    BigDecimal humidity,
    StationStatus status,
    Instant timestamp,
    Integer totalSwapsToday,
    Instant lastSwapTime) {

  public TelemetryEvent withReadings(BigDecimal temperature, BigDecimal humidity) {
    return new TelemetryEvent(
        deviceId,
        batteryAvailable,
        batteryCharging,
        temperature,
        humidity,
        status,
        timestamp,
        totalSwapsToday,
        lastSwapTime);
  }
}
