package com.scholary.aijobs.prediction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a terminal prediction into a {@link Resolution}.
 *
 * <p>Shared by the blocking poll loop and the webhook/reconciliation path so both interpret
 * provider results the same way.
 */
@Component
public class PredictionResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(PredictionResolver.class);

  public static final String NO_OUTPUT_MESSAGE = "Model succeeded but returned no output image.";
  public static final String UNKNOWN_FAILURE_MESSAGE =
      "Replicate model failed with unknown error.";

  private final PredictionGateway gateway;

  public PredictionResolver(PredictionGateway gateway) {
    this.gateway = gateway;
  }

  /**
   * Resolve a terminal prediction.
   *
   * @throws IllegalArgumentException if the prediction has not reached a terminal status
   */
  public Resolution resolve(Prediction prediction) {
    if (!prediction.isTerminal()) {
      throw new IllegalArgumentException(
          String.format(
              "Prediction %s is not terminal: %s", prediction.id(), prediction.status()));
    }

    if (prediction.status() == PredictionStatus.SUCCEEDED) {
      try {
        return Resolution.succeeded(prediction.id(), gateway.extractResult(prediction));
      } catch (NoOutputException e) {
        LOGGER.warn("Prediction {} succeeded without usable output", prediction.id());
        return Resolution.noOutput(prediction.id(), NO_OUTPUT_MESSAGE);
      }
    }

    String error = prediction.error();
    if (error == null || error.isBlank()) {
      error = UNKNOWN_FAILURE_MESSAGE;
    }
    return Resolution.failed(prediction.id(), prediction.status(), error);
  }
}
