package com.evstation.simulator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.evstation.simulator.config.properties.SimulatorProperties;
import com.evstation.simulator.model.StationTelemetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iotdataplane.IotDataPlaneClient;
import software.amazon.awssdk.services.iotdataplane.model.PublishRequest;

/**
 * Publishes station telemetry to IoT Core with at-least-once delivery.
 *
 * <p>Failures are logged and reported through the return value so that one unreachable publish
 * does not stop the rest of the round.
 */
@Service
public class TelemetryPublisher {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryPublisher.class);

  static final int QOS_AT_LEAST_ONCE = 1;

  private final IotDataPlaneClient iotDataPlaneClient;
  private final ObjectMapper objectMapper;
  private final SimulatorProperties properties;

  public TelemetryPublisher(
      IotDataPlaneClient iotDataPlaneClient,
      ObjectMapper objectMapper,
      SimulatorProperties properties) {
    this.iotDataPlaneClient = iotDataPlaneClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Publishes one telemetry message on {@code {topicPrefix}/{deviceId}/telemetry}.
   *
   * @return {@code true} when IoT Core accepted the message
   */
  public boolean publish(StationTelemetry telemetry) {
    String topic = properties.topicFor(telemetry.deviceId());
    try {
      String payload = objectMapper.writeValueAsString(telemetry);
      iotDataPlaneClient.publish(
          PublishRequest.builder()
              .topic(topic)
              .qos(QOS_AT_LEAST_ONCE)
              .payload(SdkBytes.fromUtf8String(payload))
              .build());

      logger.info(
          "Published telemetry for {}: batteries={}, temp={}°C",
          telemetry.deviceId(),
          telemetry.batteryAvailable(),
          telemetry.temperature());
      return true;

    } catch (JsonProcessingException e) {
      logger.error("Failed to serialize telemetry for {}", telemetry.deviceId(), e);
      return false;
    } catch (SdkException e) {
      logger.error("Failed to publish for {} to {}: {}", telemetry.deviceId(), topic, e.getMessage());
      return false;
    }
  }
}
