package com.evstation.simulator.config.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Settings of the station simulator.
 *
 * @param numStations number of simulated stations, named {@code station-01} upwards
 * @param interval delay between two publishing rounds
 * @param topicPrefix MQTT topic prefix, the device id and {@code /telemetry} are appended
 * @param endpoint account specific IoT Core data endpoint, without scheme
 * @param region AWS region of the endpoint
 */
@ConfigurationProperties(prefix = "simulator")
@Validated
public record SimulatorProperties(
    @Min(value = 1, message = "At least one station is required") @DefaultValue("10")
        int numStations,
    @NotNull @DefaultValue("5s") Duration interval,
    @NotBlank @DefaultValue("ev/station") String topicPrefix,
    @NotBlank @DefaultValue(PLACEHOLDER_ENDPOINT) String endpoint,
    @NotBlank @DefaultValue("us-east-1") String region) {

  public static final String PLACEHOLDER_ENDPOINT =
      "your-iot-endpoint.iot.us-east-1.amazonaws.com";

  @AssertTrue(message = "simulator.endpoint must be set to the IoT Core data endpoint of the account")
  public boolean isEndpointConfigured() {
    return endpoint == null || !endpoint.startsWith("your-iot-endpoint");
  }

  public String topicFor(String deviceId) {
    return topicPrefix + "/" + deviceId + "/telemetry";
  }
}
