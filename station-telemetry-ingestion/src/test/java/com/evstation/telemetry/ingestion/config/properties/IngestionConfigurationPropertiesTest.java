package com.evstation.telemetry.ingestion.config.properties;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

class IngestionConfigurationPropertiesTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  private static IngestionConfigurationProperties withTimings(
      Duration callTimeout, Duration attemptTimeout, Duration deadline) {
    return new IngestionConfigurationProperties(
        "ev-station-state",
        "ev-station-archive",
        "telemetry",
        callTimeout,
        attemptTimeout,
        deadline,
        false);
  }

  @Test
  void validate_DefaultTimings_NoViolations() {
    assertThat(
            validator.validate(
                withTimings(Duration.ofSeconds(10), Duration.ofSeconds(3), Duration.ofSeconds(30))))
        .isEmpty();
  }

  @Test
  void validate_ZeroDeadline_IsRejected() {
    assertThat(
            validator.validate(
                withTimings(Duration.ofSeconds(10), Duration.ofSeconds(3), Duration.ZERO)))
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactly("invocationDeadline");
  }

  @Test
  void validate_NegativeStoreTimeouts_AreRejected() {
    assertThat(
            validator.validate(
                withTimings(
                    Duration.ofSeconds(-1), Duration.ofMillis(-5), Duration.ofSeconds(30))))
        .extracting(v -> v.getPropertyPath().toString())
        .containsExactlyInAnyOrder("storeCallTimeout", "storeCallAttemptTimeout");
  }

  @Test
  void validate_MissingTableName_IsRejected() {
    IngestionConfigurationProperties properties =
        new IngestionConfigurationProperties(
            " ",
            "ev-station-archive",
            "telemetry",
            Duration.ofSeconds(10),
            Duration.ofSeconds(3),
            Duration.ofSeconds(30),
            false);

    assertThat(validator.validate(properties))
        .extracting(v -> v.getMessage())
        .containsExactly("State table name is required");
  }
}
