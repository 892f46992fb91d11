package com.scholary.aijobs.prediction;

/**
 * A prediction claimed success but carries no usable output artifact.
 *
 * <p>Provider-side anomaly, never surfaced to users as success.
 */
public class NoOutputException extends PredictionException {

  public NoOutputException(String predictionId) {
    super(
        String.format("Prediction %s succeeded but returned no output URL.", predictionId),
        predictionId,
        null);
  }
}
