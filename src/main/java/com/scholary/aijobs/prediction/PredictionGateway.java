package com.scholary.aijobs.prediction;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Uniform access to the external inference provider.
 *
 * <p>Both the blocking poll path and the webhook path go through this interface, so the
 * provider-specific parsing lives in exactly one place.
 */
public interface PredictionGateway {

  /**
   * Create a remote prediction.
   *
   * @param modelVersion the provider's model version identifier
   * @param input model input fields
   * @param callbackUrl webhook URL the provider calls on completion, or {@code null} to poll
   * @return the prediction as accepted by the provider
   * @throws SubmissionException if the provider rejects the request or cannot be reached
   */
  Prediction submit(String modelVersion, Map<String, Object> input, String callbackUrl);

  /**
   * Read the current state of a prediction.
   *
   * @throws LookupException if the provider cannot be reached or returns an error
   */
  Prediction fetch(String predictionId);

  /**
   * Pick the usable output artifact URL from a succeeded prediction.
   *
   * <p>A scalar string output is returned as is, a list output yields its first element.
   *
   * @throws NoOutputException if there is no usable output
   */
  default String extractResult(Prediction prediction) {
    JsonNode output = prediction.output();
    if (output != null && output.isTextual() && !output.asText().isBlank()) {
      return output.asText();
    }
    if (output != null && output.isArray() && !output.isEmpty()) {
      JsonNode first = output.get(0);
      if (first.isTextual() && !first.asText().isBlank()) {
        return first.asText();
      }
    }
    throw new NoOutputException(prediction.id());
  }
}
