package com.evstation.telemetry.ingestion.validation;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.evstation.telemetry.ingestion.dto.StationStatus;
import com.evstation.telemetry.ingestion.dto.TelemetryEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Schema check for inbound station telemetry.
 *
 * <p>The validator answers one question: does the message carry every required field with the
 * right JSON type? Presence of all required fields is checked first, then their types, both in
 * wire order, and the first violation wins. Values are deliberately not range-checked; the
 * pipeline trusts the stations for plausibility.
 *
 * <p><strong>Field rules:</strong>
 *
 * <ul>
 *   <li>{@code device_id}: non-blank string
 *   <li>{@code battery_available}, {@code battery_charging}: integral number
 *   <li>{@code temperature}, {@code humidity}: any number
 *   <li>{@code status}: one of {@code operational}, {@code maintenance}, {@code offline}
 *   <li>{@code timestamp}: ISO-8601 date-time string; a missing offset means UTC
 *   <li>{@code total_swaps_today} (optional): integral number
 *   <li>{@code last_swap_time} (optional): ISO-8601 date-time string
 * </ul>
 *
 * <p>A field holding JSON {@code null} is present but of the wrong type.
 *
 * <p>Decimals are read as exact {@link BigDecimal} values straight from the JSON text so that no
 * binary floating point rounding happens before normalization.
 */
@Component
public class TelemetryValidator {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryValidator.class);

  public static final String DEVICE_ID = "device_id";
  public static final String BATTERY_AVAILABLE = "battery_available";
  public static final String BATTERY_CHARGING = "battery_charging";
  public static final String TEMPERATURE = "temperature";
  public static final String HUMIDITY = "humidity";
  public static final String STATUS = "status";
  public static final String TIMESTAMP = "timestamp";
  public static final String TOTAL_SWAPS_TODAY = "total_swaps_today";
  public static final String LAST_SWAP_TIME = "last_swap_time";

  public static final List<String> REQUIRED_FIELDS =
      List.of(
          DEVICE_ID, BATTERY_AVAILABLE, BATTERY_CHARGING, TEMPERATURE, HUMIDITY, STATUS, TIMESTAMP);

  private final ObjectMapper objectMapper;

  public TelemetryValidator() {
    this.objectMapper =
        JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .build();
  }

  /**
   * Validates a raw message body.
   *
   * @param rawMessage UTF-8 JSON text as delivered by the transport
   * @return the typed event, or the first violation found
   */
  public ValidationResult validate(String rawMessage) {
    if (rawMessage == null || rawMessage.isBlank()) {
      return ValidationResult.rejected(RejectionReason.malformedPayload());
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(rawMessage);
    } catch (JsonProcessingException e) {
      logger.debug("Message body is not valid JSON: {}", e.getOriginalMessage());
      return ValidationResult.rejected(RejectionReason.malformedPayload());
    }
    return validate(root);
  }

  /**
   * Validates an already parsed message body.
   *
   * @param root parsed JSON; anything other than an object is rejected as malformed
   * @return the typed event, or the first violation found
   */
  public ValidationResult validate(JsonNode root) {
    if (root == null || !root.isObject()) {
      return ValidationResult.rejected(RejectionReason.malformedPayload());
    }

    Optional<String> missing = REQUIRED_FIELDS.stream().filter(f -> !root.has(f)).findFirst();
    if (missing.isPresent()) {
      return ValidationResult.rejected(RejectionReason.missingField(missing.get()));
    }

    JsonNode deviceId = root.get(DEVICE_ID);
    if (!deviceId.isTextual() || deviceId.asText().isBlank()) {
      return ValidationResult.rejected(RejectionReason.wrongType(DEVICE_ID));
    }
    if (!isInteger(root.get(BATTERY_AVAILABLE))) {
      return ValidationResult.rejected(RejectionReason.wrongType(BATTERY_AVAILABLE));
    }
    if (!isInteger(root.get(BATTERY_CHARGING))) {
      return ValidationResult.rejected(RejectionReason.wrongType(BATTERY_CHARGING));
    }
    if (!root.get(TEMPERATURE).isNumber()) {
      return ValidationResult.rejected(RejectionReason.wrongType(TEMPERATURE));
    }
    if (!root.get(HUMIDITY).isNumber()) {
      return ValidationResult.rejected(RejectionReason.wrongType(HUMIDITY));
    }

    JsonNode statusNode = root.get(STATUS);
    Optional<StationStatus> status =
        statusNode.isTextual()
            ? StationStatus.fromWireValue(statusNode.asText())
            : Optional.empty();
    if (status.isEmpty()) {
      return ValidationResult.rejected(RejectionReason.wrongType(STATUS));
    }

    JsonNode timestampNode = root.get(TIMESTAMP);
    if (!timestampNode.isTextual()) {
      return ValidationResult.rejected(RejectionReason.wrongType(TIMESTAMP));
    }
    Optional<Instant> timestamp = parseInstant(timestampNode.asText());
    if (timestamp.isEmpty()) {
      return ValidationResult.rejected(RejectionReason.malformedTimestamp(TIMESTAMP));
    }

    Integer totalSwapsToday = null;
    if (root.has(TOTAL_SWAPS_TODAY)) {
      if (!isInteger(root.get(TOTAL_SWAPS_TODAY))) {
        return ValidationResult.rejected(RejectionReason.wrongType(TOTAL_SWAPS_TODAY));
      }
      totalSwapsToday = root.get(TOTAL_SWAPS_TODAY).intValue();
    }

    Instant lastSwapTime = null;
    if (root.has(LAST_SWAP_TIME)) {
      JsonNode lastSwapNode = root.get(LAST_SWAP_TIME);
      if (!lastSwapNode.isTextual()) {
        return ValidationResult.rejected(RejectionReason.wrongType(LAST_SWAP_TIME));
      }
      Optional<Instant> parsed = parseInstant(lastSwapNode.asText());
      if (parsed.isEmpty()) {
        return ValidationResult.rejected(RejectionReason.malformedTimestamp(LAST_SWAP_TIME));
      }
      lastSwapTime = parsed.get();
    }

    return ValidationResult.valid(
        new TelemetryEvent(
            deviceId.asText(),
            root.get(BATTERY_AVAILABLE).intValue(),
            root.get(BATTERY_CHARGING).intValue(),
            root.get(TEMPERATURE).decimalValue(),
            root.get(HUMIDITY).decimalValue(),
            status.get(),
            timestamp.get(),
            totalSwapsToday,
            lastSwapTime));
  }

  private static boolean isInteger(JsonNode node) {
    return node.isIntegralNumber() && node.canConvertToInt();
  }

  /** Parses an ISO-8601 date-time, reading a value without offset as UTC. */
  static Optional<Instant> parseInstant(String text) {
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return Optional.of(offsetDateTime.toInstant());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
