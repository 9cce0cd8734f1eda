package com.evstation.simulator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One telemetry message as published on the station topic. */
public record StationTelemetry(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("battery_available") int batteryAvailable,
    @JsonProperty("battery_charging") int batteryCharging,
    @JsonProperty("temperature") double temperature,
    @JsonProperty("humidity") double humidity,
    @JsonProperty("status") String status,
    @JsonProperty("total_swaps_today") int totalSwapsToday,
    @JsonProperty("last_swap_time") String lastSwapTime,
    @JsonProperty("timestamp") String timestamp) {}
