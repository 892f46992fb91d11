package com.scholary.aijobs.prediction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The provider's view of one inference execution.
 *
 * <p>Read-only from our side: we only ever observe it through submit/fetch calls or webhook
 * deliveries. {@code output} is kept as a raw JSON node because the provider returns either a
 * single string or an ordered list of strings depending on the model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Prediction(
    String id,
    String version,
    PredictionStatus status,
    JsonNode output,
    String error,
    String logs,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("completed_at") String completedAt,
    Urls urls) {

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Urls(String get, String cancel) {}
}
