package com.scholary.aijobs.job;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of asynchronous job, with the wording used when telling users about them. */
public enum JobType {
  VIRTUAL_TRY_ON("virtual_try_on", "Try-On", "virtual try-on");

  private final String wireValue;
  private final String title;
  private final String description;

  JobType(String wireValue, String title, String description) {
    this.wireValue = wireValue;
    this.title = title;
    this.description = description;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /** Short name for notification titles, e.g. "Try-On". */
  public String title() {
    return title;
  }

  /** Lower-case name for sentences, e.g. "virtual try-on". */
  public String description() {
    return description;
  }
}
