package com.scholary.aijobs.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job-level status, distinct from the provider's prediction status.
 *
 * <p>A {@code succeeded} prediction ends as {@link #COMPLETED}; {@code failed} and {@code canceled}
 * end as {@link #FAILED}.
 */
public enum JobStatus {
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireValue;

  JobStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this != PROCESSING;
  }
}
