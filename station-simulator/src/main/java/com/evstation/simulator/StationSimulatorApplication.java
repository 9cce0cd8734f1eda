package com.evstation.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Simulated fleet of battery swap stations.
 *
 * <p>Every interval each station advances its simulated state and publishes one telemetry message
 * to AWS IoT Core, where the IoT rule forwards it to the ingestion queue.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.evstation.simulator.config.properties")
public class StationSimulatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(StationSimulatorApplication.class, args);
  }
}
