package com.evstation.telemetry.ingestion.validation;

/**
 * Why an inbound message was rejected, naming the offending field.
 *
 * @param kind category of the violation
 * @param field wire name of the field, or {@code body} when the message itself is unusable
 */
public record RejectionReason(Kind kind, String field) {

  public enum Kind {
    MISSING_FIELD("missing_field"),
    WRONG_TYPE("wrong_type"),
    MALFORMED_TIMESTAMP("malformed_timestamp"),
    MALFORMED_PAYLOAD("malformed_payload"),
    OUT_OF_STORE_RANGE("out_of_store_range");

    private final String code;

    Kind(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  public static RejectionReason missingField(String field) {
    return new RejectionReason(Kind.MISSING_FIELD, field);
  }

  public static RejectionReason wrongType(String field) {
    return new RejectionReason(Kind.WRONG_TYPE, field);
  }

  public static RejectionReason malformedTimestamp(String field) {
    return new RejectionReason(Kind.MALFORMED_TIMESTAMP, field);
  }

  /** A number too large for the state store to hold. */
  public static RejectionReason outOfStoreRange(String field) {
    return new RejectionReason(Kind.OUT_OF_STORE_RANGE, field);
  }

  public static RejectionReason malformedPayload() {
    return new RejectionReason(Kind.MALFORMED_PAYLOAD, "body");
  }

  /** Renders the reason as {@code <kind>:<field>}, e.g. {@code missing_field:timestamp}. */
  public String code() {
    return kind.code() + ":" + field;
  }

  @Override
  public String toString() {
    return code();
  }
}
