package com.scholary.aijobs.prediction;

/**
 * What a terminal prediction means for the job that is waiting on it.
 *
 * <p>Exactly one of {@code resultUrl} and {@code errorMessage} is set.
 */
public record Resolution(
    String predictionId,
    PredictionStatus providerStatus,
    Outcome outcome,
    String resultUrl,
    String errorMessage) {

  public enum Outcome {
    /** Succeeded with a usable output URL. */
    SUCCEEDED,
    /** Provider reported failed or canceled. */
    FAILED,
    /** Provider reported success without usable output. */
    NO_OUTPUT
  }

  public static Resolution succeeded(String predictionId, String resultUrl) {
    return new Resolution(
        predictionId, PredictionStatus.SUCCEEDED, Outcome.SUCCEEDED, resultUrl, null);
  }

  public static Resolution failed(
      String predictionId, PredictionStatus providerStatus, String errorMessage) {
    return new Resolution(predictionId, providerStatus, Outcome.FAILED, null, errorMessage);
  }

  public static Resolution noOutput(String predictionId, String errorMessage) {
    return new Resolution(
        predictionId, PredictionStatus.SUCCEEDED, Outcome.NO_OUTPUT, null, errorMessage);
  }

  public boolean isSuccess() {
    return outcome == Outcome.SUCCEEDED;
  }
}
