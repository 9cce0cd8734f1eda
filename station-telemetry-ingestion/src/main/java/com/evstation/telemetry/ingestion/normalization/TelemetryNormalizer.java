package com.evstation.telemetry.ingestion.normalization;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.evstation.telemetry.ingestion.dto.TelemetryEvent;
import com.evstation.telemetry.ingestion.validation.TelemetryValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Brings a validated event into the representation the two stores need.
 *
 * <p>DynamoDB numbers carry at most 38 significant digits and have no binary floating point type,
 * so sensor decimals are rounded half-to-even to that precision. Magnitudes below the smallest
 * positive store number round half-to-even at that position, which takes them to zero or to the
 * smallest number itself. Magnitudes above the largest store number cannot be held at all and
 * raise {@link UnrepresentableNumberException}. The archive receives a canonical
 * JSON rendering of the event: keys sorted, two-space indentation, {@code \n} line breaks and
 * decimals in plain notation, so equal events always produce equal bytes.
 *
 * <p>Both operations are pure and idempotent.
 */
@Component
public class TelemetryNormalizer {

  /** Precision of a DynamoDB number. */
  public static final MathContext STORE_PRECISION = new MathContext(38, RoundingMode.HALF_EVEN);

  /** Scale of the smallest positive DynamoDB number, {@code 1E-130}. */
  static final int STORE_MIN_SCALE = 130;

  /** Largest DynamoDB number, 38 nines times {@code 1E+88}. */
  public static final BigDecimal STORE_MAX_MAGNITUDE =
      new BigDecimal("9.9999999999999999999999999999999999999E+125");

  private static final BigDecimal STORE_MIN_MAGNITUDE =
      BigDecimal.ONE.scaleByPowerOfTen(-STORE_MIN_SCALE);

  private final ObjectWriter archiveWriter;

  public TelemetryNormalizer() {
    DefaultPrettyPrinter printer =
        new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"))
            .withSeparators(
                Separators.createDefaultInstance()
                    .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
    this.archiveWriter =
        JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build()
            .writer(printer);
  }

  /**
   * Returns the event with its decimal readings as store numbers.
   *
   * @throws UnrepresentableNumberException if a reading is larger than any store number
   */
  public TelemetryEvent normalize(TelemetryEvent event) {
    return event.withReadings(
        toStoreNumber(TelemetryValidator.TEMPERATURE, event.temperature()),
        toStoreNumber(TelemetryValidator.HUMIDITY, event.humidity()));
  }

  /**
   * Rounds a decimal to the store precision and flushes magnitudes below {@code 1E-130}. Values
   * that already fit are returned unchanged, including their scale, so {@code 42.0} stays {@code
   * 42.0}.
   */
  public BigDecimal toStorePrecision(BigDecimal value) {
    if (value == null) {
      return null;
    }
    BigDecimal rounded =
        value.precision() <= STORE_PRECISION.getPrecision() ? value : value.round(STORE_PRECISION);
    if (rounded.signum() != 0 && rounded.abs().compareTo(STORE_MIN_MAGNITUDE) < 0) {
      BigDecimal flushed = rounded.setScale(STORE_MIN_SCALE, RoundingMode.HALF_EVEN);
      return flushed.signum() == 0 ? BigDecimal.ZERO : flushed.stripTrailingZeros();
    }
    return rounded;
  }

  private BigDecimal toStoreNumber(String field, BigDecimal value) {
    BigDecimal stored = toStorePrecision(value);
    if (stored != null && stored.abs().compareTo(STORE_MAX_MAGNITUDE) > 0) {
      throw new UnrepresentableNumberException(field, value);
    }
    return stored;
  }

  /**
   * Renders the event as canonical UTF-8 JSON for the archive. Optional fields that were not
   * reported are omitted.
   */
  public byte[] toArchiveBytes(TelemetryEvent event) {
    Map<String, Object> body = new TreeMap<>();
    body.put(TelemetryValidator.DEVICE_ID, event.deviceId());
    body.put(TelemetryValidator.BATTERY_AVAILABLE, event.batteryAvailable());
    body.put(TelemetryValidator.BATTERY_CHARGING, event.batteryCharging());
    body.put(TelemetryValidator.TEMPERATURE, toStorePrecision(event.temperature()));
    body.put(TelemetryValidator.HUMIDITY, toStorePrecision(event.humidity()));
    body.put(TelemetryValidator.STATUS, event.status().wireValue());
    body.put(TelemetryValidator.TIMESTAMP, event.timestamp().toString());
    if (event.totalSwapsToday() != null) {
      body.put(TelemetryValidator.TOTAL_SWAPS_TODAY, event.totalSwapsToday());
    }
    if (event.lastSwapTime() != null) {
      body.put(TelemetryValidator.LAST_SWAP_TIME, event.lastSwapTime().toString());
    }

    try {
      return archiveWriter.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException e) {
      // Map of strings, numbers and booleans only
      throw new IllegalStateException("Failed to render archive body for " + event.deviceId(), e);
    }
  }
}
