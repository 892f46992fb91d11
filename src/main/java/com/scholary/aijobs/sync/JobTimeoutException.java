package com.scholary.aijobs.sync;

import com.scholary.aijobs.prediction.PredictionException;
import java.time.Duration;

/**
 * The poll loop hit its attempt ceiling before the prediction reached a terminal status.
 *
 * <p>Kept apart from explicit provider failures: a timeout is a deadline breach, and retrying
 * may well succeed.
 */
public class JobTimeoutException extends PredictionException {

  private final int attempts;

  public JobTimeoutException(
      String predictionId, int attempts, Duration pollInterval, Throwable lastFailure) {
    super(
        String.format(
            "Prediction %s did not complete within %d polls at %ds intervals",
            predictionId, attempts, pollInterval.toSeconds()),
        predictionId,
        lastFailure);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
