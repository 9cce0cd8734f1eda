package com.evstation.telemetry.ingestion.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Latest known state of a station, one DynamoDB item per device.
 *
 * <p>Every accepted event overwrites the whole item; there is no version attribute and no
 * condition on the write.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamoDbBean
public class StationStateRecord {

  private String deviceId;
  private Integer batteryAvailable;
  private Integer batteryCharging;
  private BigDecimal temperature;
  private BigDecimal humidity;
  private String status;
  private String timestamp;
  private Integer totalSwapsToday;
  private String lastSwapTime;
  private String lastUpdated;

  @DynamoDbPartitionKey
  @DynamoDbAttribute("device_id")
  public String getDeviceId() {
    return deviceId;
  }

  @DynamoDbAttribute("battery_available")
  public Integer getBatteryAvailable() {
    return batteryAvailable;
  }

  @DynamoDbAttribute("battery_charging")
  public Integer getBatteryCharging() {
    return batteryCharging;
  }

  @DynamoDbAttribute("temperature")
  public BigDecimal getTemperature() {
    return temperature;
  }

  @DynamoDbAttribute("humidity")
  public BigDecimal getHumidity() {
    return humidity;
  }

  @DynamoDbAttribute("status")
  public String getStatus() {
    return status;
  }

  @DynamoDbAttribute("timestamp")
  public String getTimestamp() {
    return timestamp;
  }

  @DynamoDbAttribute("total_swaps_today")
  public Integer getTotalSwapsToday() {
    return totalSwapsToday;
  }

  @DynamoDbAttribute("last_swap_time")
  public String getLastSwapTime() {
    return lastSwapTime;
  }

  @DynamoDbAttribute("last_updated")
  public String getLastUpdated() {
    return lastUpdated;
  }
}
