package com.evstation.simulator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Random;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Simulated state of a single battery swap station.
 *
 * <p>Each call to {@link #update()} advances the station by one step: charging batteries may
 * complete, a customer may swap a battery, temperature and humidity drift within their bounds,
 * and the station may enter or leave maintenance.
 */
@Slf4j
@Getter
public class BatterySwapStation {

  static final String OPERATIONAL = "operational";
  static final String MAINTENANCE = "maintenance";

  static final double CHARGE_COMPLETE_PROBABILITY = 0.20;
  static final double SWAP_PROBABILITY = 0.15;
  static final double ENTER_MAINTENANCE_PROBABILITY = 0.01;
  static final double EXIT_MAINTENANCE_PROBABILITY = 0.10;

  static final double MIN_TEMPERATURE = 15.0;
  static final double MAX_TEMPERATURE = 35.0;
  static final double TEMPERATURE_STEP = 0.5;
  static final double MIN_HUMIDITY = 20.0;
  static final double MAX_HUMIDITY = 80.0;
  static final double HUMIDITY_STEP = 2.0;

  private final String deviceId;
  private final Random random;
  private final Clock clock;

  private int batteryAvailable;
  private int batteryCharging;
  private double temperature;
  private double humidity;
  private String status;
  private int totalSwapsToday;
  private String lastSwapTime;

  public BatterySwapStation(String deviceId, Random random, Clock clock) {
    this.deviceId = deviceId;
    this.random = random;
    this.clock = clock;

    this.batteryAvailable = 8 + random.nextInt(8);
    this.batteryCharging = 2 + random.nextInt(5);
    this.temperature = 20.0 + random.nextDouble() * 10.0;
    this.humidity = 30.0 + random.nextDouble() * 30.0;
    this.status = OPERATIONAL;
    this.totalSwapsToday = random.nextInt(51);
    this.lastSwapTime = clock.instant().toString();

    log.info("Initialized {} with {} available batteries", deviceId, batteryAvailable);
  }

  /** Advances the station by one simulation step. */
  public void update() {
    simulateBatteryCharging();
    simulateBatterySwap();
    simulateTemperatureChange();
    simulateHumidityChange();
    simulateStatusChange();
  }

  /** Current state as a telemetry message stamped with the current instant. */
  public StationTelemetry getTelemetry() {
    return new StationTelemetry(
        deviceId,
        batteryAvailable,
        batteryCharging,
        roundToTenth(temperature),
        roundToTenth(humidity),
        status,
        totalSwapsToday,
        lastSwapTime,
        clock.instant().toString());
  }

  void simulateBatteryCharging() {
    if (batteryCharging > 0 && random.nextDouble() < CHARGE_COMPLETE_PROBABILITY) {
      batteryCharging--;
      batteryAvailable++;
      log.debug("{}: Battery finished charging", deviceId);
    }
  }

  void simulateBatterySwap() {
    if (batteryAvailable > 0 && random.nextDouble() < SWAP_PROBABILITY) {
      batteryAvailable--;
      batteryCharging++;
      totalSwapsToday++;
      lastSwapTime = clock.instant().toString();
      log.info("{}: Battery swap performed (total today: {})", deviceId, totalSwapsToday);
    }
  }

  void simulateTemperatureChange() {
    temperature = clamp(temperature + step(TEMPERATURE_STEP), MIN_TEMPERATURE, MAX_TEMPERATURE);
  }

  void simulateHumidityChange() {
    humidity = clamp(humidity + step(HUMIDITY_STEP), MIN_HUMIDITY, MAX_HUMIDITY);
  }

  void simulateStatusChange() {
    if (OPERATIONAL.equals(status) && random.nextDouble() < ENTER_MAINTENANCE_PROBABILITY) {
      status = MAINTENANCE;
      log.warn("{}: Entering maintenance mode", deviceId);
    } else if (MAINTENANCE.equals(status) && random.nextDouble() < EXIT_MAINTENANCE_PROBABILITY) {
      status = OPERATIONAL;
      log.info("{}: Exiting maintenance mode", deviceId);
    }
  }

  /** Uniform value in [-amplitude, amplitude). */
  private double step(double amplitude) {
    return (random.nextDouble() * 2.0 - 1.0) * amplitude;
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  private static double roundToTenth(double value) {
    return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
  }
}
