package com.scholary.aijobs.prediction;

/**
 * Base class for failures talking to, or reported by, the inference provider.
 *
 * <p>Unchecked: callers map these to a small set of user-facing outcomes at the API boundary.
 */
public class PredictionException extends RuntimeException {

  private final String predictionId;

  public PredictionException(String message) {
    this(message, null, null);
  }

  public PredictionException(String message, String predictionId, Throwable cause) {
    super(message, cause);
    this.predictionId = predictionId;
  }

  /** The prediction concerned, or {@code null} when none was created yet. */
  public String getPredictionId() {
    return predictionId;
  }
}
