package com.evstation.simulator.config;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.evstation.simulator.config.properties.SimulatorProperties;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iotdataplane.IotDataPlaneClient;

/** AWS IoT data plane client and the simulation sources of time and randomness. */
@Slf4j
@Configuration
public class IotDataPlaneConfiguration {

  @Bean
  public IotDataPlaneClient iotDataPlaneClient(SimulatorProperties properties) {
    log.info(
        "Configuring IoT data plane client for endpoint {} in region {}",
        properties.endpoint(),
        properties.region());

    return IotDataPlaneClient.builder()
        .region(Region.of(properties.region()))
        .endpointOverride(URI.create("https://" + properties.endpoint()))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .overrideConfiguration(
            ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofSeconds(10))
                .apiCallAttemptTimeout(Duration.ofSeconds(3))
                .build())
        .build();
  }

  @Bean
  public Random simulationRandom() {
    return new Random();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
