package com.evstation.simulator.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.evstation.simulator.config.properties.SimulatorProperties;
import com.evstation.simulator.model.BatterySwapStation;

import lombok.extern.slf4j.Slf4j;

/** Drives the simulated fleet: one update and one publish per station every interval. */
@Slf4j
@Service
public class SimulationRunner {

  private final List<BatterySwapStation> stations;
  private final TelemetryPublisher publisher;

  public SimulationRunner(
      SimulatorProperties properties, TelemetryPublisher publisher, Random random, Clock clock) {
    this.publisher = publisher;

    List<BatterySwapStation> created = new ArrayList<>(properties.numStations());
    for (int i = 1; i <= properties.numStations(); i++) {
      created.add(new BatterySwapStation(String.format("station-%02d", i), random, clock));
    }
    this.stations = Collections.unmodifiableList(created);

    log.info(
        "Created {} simulated stations, publishing every {}",
        stations.size(),
        properties.interval());
  }

  @Scheduled(fixedDelayString = "${simulator.interval:PT5S}")
  public void tick() {
    runRound();
  }

  /** Runs one simulation round and returns the number of messages IoT Core accepted. */
  public int runRound() {
    int published = 0;
    for (BatterySwapStation station : stations) {
      station.update();
      if (publisher.publish(station.getTelemetry())) {
        published++;
      }
    }

    if (published < stations.size()) {
      log.warn("Published {} of {} station messages", published, stations.size());
    } else {
      log.debug("Published telemetry for all {} stations", published);
    }
    return published;
  }

  public List<BatterySwapStation> getStations() {
    return stations;
  }
}
