package com.evstation.query.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Latest state of one station as stored by the ingestion service.
 *
 * <p>Rendered with the same snake_case names as the stored attributes. Attributes a station never
 * reported are left out of the JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamoDbBean
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StationState {

  @JsonProperty("device_id")
  private String deviceId;

  @JsonProperty("battery_available")
  private Integer batteryAvailable;

  @JsonProperty("battery_charging")
  private Integer batteryCharging;

  @JsonProperty("temperature")
  private BigDecimal temperature;

  @JsonProperty("humidity")
  private BigDecimal humidity;

  @JsonProperty("status")
  private String status;

  @JsonProperty("timestamp")
  private String timestamp;

  @JsonProperty("total_swaps_today")
  private Integer totalSwapsToday;

  @JsonProperty("last_swap_time")
  private String lastSwapTime;

  @JsonProperty("last_updated")
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
