package com.evstation.telemetry.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Station Telemetry Ingestion Service.
 *
 * <p>This service consumes station telemetry forwarded by the IoT Core rule into SQS, validates
 * and normalizes every event, upserts the latest state of the station into DynamoDB and appends
 * the normalized event to the S3 archive.
 *
 * <p><strong>Data Flow:</strong>
 *
 * <ol>
 *   <li>Station publishes telemetry over MQTT to IoT Core
 *   <li>IoT rule forwards the payload to the ingestion SQS queue
 *   <li>Service validates and normalizes the event
 *   <li>Latest state is written to DynamoDB, keyed by device id
 *   <li>Normalized event is archived to S3 under a date-partitioned key
 * </ol>
 *
 * @author EV Station Platform Team
 * @version 1.0
 * @since 2024
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.evstation.telemetry.ingestion.config.properties")
public class StationTelemetryIngestionApplication {

  public static void main(String[] args) {
    SpringApplication.run(StationTelemetryIngestionApplication.class, args);
  }
}
