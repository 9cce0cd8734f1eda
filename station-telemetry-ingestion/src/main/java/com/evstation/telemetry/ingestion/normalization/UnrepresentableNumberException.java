package com.evstation.telemetry.ingestion.normalization;

import java.math.BigDecimal;
import java.math.MathContext;

/** A reading whose magnitude exceeds the largest number the state store can hold. */
public class UnrepresentableNumberException extends RuntimeException {

  private final String field;

  public UnrepresentableNumberException(String field, BigDecimal value) {
    super(
        "Value of "
            + field
            + " exceeds the store number range: "
            + value.round(new MathContext(6)));
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
