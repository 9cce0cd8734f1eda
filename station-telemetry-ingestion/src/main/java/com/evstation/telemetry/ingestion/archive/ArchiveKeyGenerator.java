package com.evstation.telemetry.ingestion.archive;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.evstation.telemetry.ingestion.config.properties.IngestionConfigurationProperties;
import com.evstation.telemetry.ingestion.dto.TelemetryEvent;

/**
 * Builds archive object keys.
 *
 * <p>Layout: {@code <prefix>/year=YYYY/month=MM/day=DD/<device>_<yyyyMMdd_HHmmss>_<token>.json}.
 * Date parts come from the event timestamp in UTC, so objects land in the partition of the
 * reading, not of its arrival. The token is the first eight hex digits of a random UUID; every
 * call yields a new key, including for a redelivered event.
 */
@Component
public class ArchiveKeyGenerator {

  private static final DateTimeFormatter KEY_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final String prefix;
  private final Supplier<UUID> tokenSource;

  @Autowired
  public ArchiveKeyGenerator(IngestionConfigurationProperties ingestionConfig) {
    this(ingestionConfig.archivePrefix(), UUID::randomUUID);
  }

  public ArchiveKeyGenerator(String prefix, Supplier<UUID> tokenSource) {
    this.prefix = stripSlashes(prefix);
    this.tokenSource = tokenSource;
  }

  public String keyFor(TelemetryEvent event) {
    ZonedDateTime time = event.timestamp().atZone(ZoneOffset.UTC);
    String token = tokenSource.get().toString().replace("-", "").substring(0, 8);

    return String.format(
        "%syear=%04d/month=%02d/day=%02d/%s_%s_%s.json",
        prefix.isEmpty() ? "" : prefix + "/",
        time.getYear(),
        time.getMonthValue(),
        time.getDayOfMonth(),
        event.deviceId(),
        KEY_TIME_FORMAT.format(time),
        token);
  }

  private static String stripSlashes(String value) {
    if (value == null) {
      return "";
    }
    return value.replaceAll("^/+", "").replaceAll("/+$", "");
  }
}
