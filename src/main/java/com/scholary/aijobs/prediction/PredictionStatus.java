package com.scholary.aijobs.prediction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a prediction as reported by the provider. */
public enum PredictionStatus {
  STARTING("starting"),
  PROCESSING("processing"),
  SUCCEEDED("succeeded"),
  FAILED("failed"),
  CANCELED("canceled"),
  /** Any status value this service does not recognise. Never terminal. */
  UNKNOWN("unknown");

  private final String wireValue;

  PredictionStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /** No further transition happens from a terminal status. */
  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELED;
  }

  /** Map a wire value to a status; unrecognised values become {@link #UNKNOWN}. */
  @JsonCreator
  public static PredictionStatus fromWire(String value) {
    if (value == null) {
      return null;
    }
    for (PredictionStatus status : values()) {
      if (status.wireValue.equalsIgnoreCase(value)) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
