package com.scholary.aijobs.prediction;

/**
 * The provider reported {@code failed} or {@code canceled}.
 *
 * <p>The message is the provider's error text where it supplied one. Retrying without changing
 * the input is unlikely to help.
 */
public class PredictionFailedException extends PredictionException {

  private final PredictionStatus status;

  public PredictionFailedException(String predictionId, PredictionStatus status, String message) {
    super(message, predictionId, null);
    this.status = status;
  }

  public PredictionStatus getStatus() {
    return status;
  }
}
