package com.evstation.simulator.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.evstation.simulator.support.MutableClock;
import com.evstation.simulator.support.ScriptedRandom;

class BatterySwapStationTest {

  private static final Instant START = Instant.parse("2024-01-15T14:23:45Z");

  private ScriptedRandom random;
  private MutableClock clock;
  private BatterySwapStation station;

  @BeforeEach
  void setUp() {
    // initial temperature 25.0 and humidity 45.0, bounded ints all at their minimum
    random = new ScriptedRandom(0.5, 0.5);
    clock = new MutableClock(START);
    station = new BatterySwapStation("station-01", random, clock);
  }

  @Test
  void startsOperationalWithInitialValuesInRange() {
    assertThat(station.getBatteryAvailable()).isEqualTo(8);
    assertThat(station.getBatteryCharging()).isEqualTo(2);
    assertThat(station.getTemperature()).isEqualTo(25.0);
    assertThat(station.getHumidity()).isEqualTo(45.0);
    assertThat(station.getStatus()).isEqualTo("operational");
    assertThat(station.getTotalSwapsToday()).isZero();
    assertThat(station.getLastSwapTime()).isEqualTo("2024-01-15T14:23:45Z");
  }

  @Nested
  class Charging {

    @Test
    void chargingBatteryBecomesAvailableBelowThreshold() {
      random.then(0.19);

      station.simulateBatteryCharging();

      assertThat(station.getBatteryCharging()).isEqualTo(1);
      assertThat(station.getBatteryAvailable()).isEqualTo(9);
    }

    @Test
    void nothingChangesAtThreshold() {
      random.then(0.2);

      station.simulateBatteryCharging();

      assertThat(station.getBatteryCharging()).isEqualTo(2);
      assertThat(station.getBatteryAvailable()).isEqualTo(8);
    }

    @Test
    void noChargingBatteriesConsumesNoRandomness() {
      random.then(0.1, 0.1);
      station.simulateBatteryCharging();
      station.simulateBatteryCharging();

      station.simulateBatteryCharging();

      assertThat(station.getBatteryCharging()).isZero();
      assertThat(station.getBatteryAvailable()).isEqualTo(10);
      assertThat(random.remaining()).isZero();
    }
  }

  @Nested
  class Swapping {

    @Test
    void swapMovesBatteryToChargingAndRecordsTime() {
      clock.advance(Duration.ofMinutes(5));
      random.then(0.1);

      station.simulateBatterySwap();

      assertThat(station.getBatteryAvailable()).isEqualTo(7);
      assertThat(station.getBatteryCharging()).isEqualTo(3);
      assertThat(station.getTotalSwapsToday()).isEqualTo(1);
      assertThat(station.getLastSwapTime()).isEqualTo("2024-01-15T14:28:45Z");
    }

    @Test
    void noSwapAtThreshold() {
      random.then(0.15);

      station.simulateBatterySwap();

      assertThat(station.getBatteryAvailable()).isEqualTo(8);
      assertThat(station.getTotalSwapsToday()).isZero();
      assertThat(station.getLastSwapTime()).isEqualTo("2024-01-15T14:23:45Z");
    }
  }

  @Nested
  class Environment {

    @Test
    void temperatureDriftsByAtMostHalfADegree() {
      random.then(0.0);

      station.simulateTemperatureChange();

      assertThat(station.getTemperature()).isEqualTo(24.5);
    }

    @Test
    void temperatureStaysAboveLowerBound() {
      for (int i = 0; i < 30; i++) {
        random.then(0.0);
        station.simulateTemperatureChange();
      }

      assertThat(station.getTemperature()).isEqualTo(15.0);
    }

    @Test
    void humidityStaysBelowUpperBound() {
      for (int i = 0; i < 30; i++) {
        random.then(0.99);
        station.simulateHumidityChange();
      }

      assertThat(station.getHumidity()).isEqualTo(80.0);
    }
  }

  @Nested
  class Status {

    @Test
    void entersMaintenanceBelowOnePercent() {
      random.then(0.005);

      station.simulateStatusChange();

      assertThat(station.getStatus()).isEqualTo("maintenance");
    }

    @Test
    void staysOperationalAtOnePercent() {
      random.then(0.01);

      station.simulateStatusChange();

      assertThat(station.getStatus()).isEqualTo("operational");
    }

    @Test
    void leavesMaintenanceBelowTenPercent() {
      random.then(0.005, 0.05);
      station.simulateStatusChange();

      station.simulateStatusChange();

      assertThat(station.getStatus()).isEqualTo("operational");
    }

    @Test
    void staysInMaintenanceAtTenPercent() {
      random.then(0.005, 0.1);
      station.simulateStatusChange();

      station.simulateStatusChange();

      assertThat(station.getStatus()).isEqualTo("maintenance");
    }
  }

  @Test
  void updateRunsEveryStepInOrder() {
    random.then(0.1, 0.1, 0.5, 0.5, 0.5);

    station.update();

    assertThat(station.getBatteryAvailable()).isEqualTo(8);
    assertThat(station.getBatteryCharging()).isEqualTo(2);
    assertThat(station.getTotalSwapsToday()).isEqualTo(1);
    assertThat(station.getTemperature()).isEqualTo(25.0);
    assertThat(station.getHumidity()).isEqualTo(45.0);
    assertThat(station.getStatus()).isEqualTo("operational");
    assertThat(random.remaining()).isZero();
  }

  @Test
  void telemetryRoundsEnvironmentToOneDecimalAndStampsCurrentTime() {
    BatterySwapStation rounded =
        new BatterySwapStation("station-07", new ScriptedRandom(0.123, 0.5), clock);
    clock.advance(Duration.ofSeconds(30));

    StationTelemetry telemetry = rounded.getTelemetry();

    assertThat(telemetry.deviceId()).isEqualTo("station-07");
    assertThat(telemetry.temperature()).isEqualTo(21.2);
    assertThat(telemetry.humidity()).isEqualTo(45.0);
    assertThat(telemetry.status()).isEqualTo("operational");
    assertThat(telemetry.lastSwapTime()).isEqualTo("2024-01-15T14:23:45Z");
    assertThat(telemetry.timestamp()).isEqualTo("2024-01-15T14:24:15Z");
  }

  @Test
  void longRunKeepsValuesWithinBoundsAndBatteriesConserved() {
    BatterySwapStation seeded = new BatterySwapStation("station-02", new Random(42), clock);
    int fleet = seeded.getBatteryAvailable() + seeded.getBatteryCharging();

    for (int i = 0; i < 5_000; i++) {
      seeded.update();

      assertThat(seeded.getBatteryAvailable()).isNotNegative();
      assertThat(seeded.getBatteryCharging()).isNotNegative();
      assertThat(seeded.getBatteryAvailable() + seeded.getBatteryCharging()).isEqualTo(fleet);
      assertThat(seeded.getTemperature()).isBetween(15.0, 35.0);
      assertThat(seeded.getHumidity()).isBetween(20.0, 80.0);
      assertThat(seeded.getStatus()).isIn("operational", "maintenance");
    }
  }
}
