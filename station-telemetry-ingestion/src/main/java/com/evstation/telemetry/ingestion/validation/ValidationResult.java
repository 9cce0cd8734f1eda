package com.evstation.telemetry.ingestion.validation;

import com.evstation.telemetry.ingestion.dto.TelemetryEvent;

/**
 * Result of validating one inbound message: either the typed event or the reason it was
 * rejected, never both.
 */
public record ValidationResult(TelemetryEvent event, RejectionReason rejection) {

  public static ValidationResult valid(TelemetryEvent event) {
    return new ValidationResult(event, null);
  }

  public static ValidationResult rejected(RejectionReason reason) {
    return new ValidationResult(null, reason);
  }

  public boolean isValid() {
    return rejection == null;
  }
}
