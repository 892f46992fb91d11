package com.scholary.aijobs.sync;

import com.scholary.aijobs.config.JobsProperties;
import com.scholary.aijobs.logging.StructuredLogger;
import com.scholary.aijobs.prediction.LookupException;
import com.scholary.aijobs.prediction.NoOutputException;
import com.scholary.aijobs.prediction.Prediction;
import com.scholary.aijobs.prediction.PredictionException;
import com.scholary.aijobs.prediction.PredictionFailedException;
import com.scholary.aijobs.prediction.PredictionGateway;
import com.scholary.aijobs.prediction.PredictionResolver;
import com.scholary.aijobs.prediction.Resolution;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Drives a prediction to completion by blocking the calling request on a bounded poll loop.
 *
 * <p>State machine: {@code submitted -> polling -> resolved | failed | timed_out}. Both the poll
 * interval and the attempt ceiling are fixed, which caps how long a caller can be held. At most
 * {@code maxAttempts} fetch calls are made and there is no sleep after the last one.
 *
 * <p>A failed lookup does not fail the job: it consumes an attempt and polling continues. Only a
 * run of {@code maxConsecutiveLookupFailures} failed lookups in a row aborts with the last
 * {@link LookupException}, since the provider is then most likely unreachable.
 */
@Component
public class SyncJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PredictionGateway gateway;
  private final PredictionResolver resolver;
  private final Duration pollInterval;
  private final int maxAttempts;
  private final int maxConsecutiveLookupFailures;

  @Autowired
  public SyncJobRunner(
      PredictionGateway gateway, PredictionResolver resolver, JobsProperties properties) {
    this(
        gateway,
        resolver,
        properties.sync().pollInterval(),
        properties.sync().maxAttempts(),
        properties.sync().maxConsecutiveLookupFailures());
  }

  SyncJobRunner(
      PredictionGateway gateway,
      PredictionResolver resolver,
      Duration pollInterval,
      int maxAttempts,
      int maxConsecutiveLookupFailures) {
    this.gateway = gateway;
    this.resolver = resolver;
    this.pollInterval = pollInterval;
    this.maxAttempts = maxAttempts;
    this.maxConsecutiveLookupFailures = maxConsecutiveLookupFailures;
  }

  /**
   * Submit a prediction without a webhook and wait for it.
   *
   * @throws com.scholary.aijobs.prediction.SubmissionException if the submission fails
   * @see #await(Prediction)
   */
  public SyncOutcome run(String modelVersion, Map<String, Object> input) {
    Prediction submitted = gateway.submit(modelVersion, input, null);
    structuredLogger.logPredictionSubmitted(submitted.id(), modelVersion, false);
    return await(submitted);
  }

  /**
   * Poll a submitted prediction until it is terminal or the attempt ceiling is reached.
   *
   * @return the resolved output
   * @throws PredictionFailedException if the provider reported failed or canceled
   * @throws NoOutputException if the provider reported success without usable output
   * @throws JobTimeoutException if the attempt ceiling was reached
   * @throws LookupException if too many consecutive lookups failed
   */
  public SyncOutcome await(Prediction submitted) {
    String predictionId = submitted.id();
    if (submitted.isTerminal()) {
      return toOutcome(resolver.resolve(submitted), 0);
    }

    int consecutiveLookupFailures = 0;
    LookupException lastLookupFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Prediction current;
      try {
        current = gateway.fetch(predictionId);
        consecutiveLookupFailures = 0;
      } catch (LookupException e) {
        consecutiveLookupFailures++;
        lastLookupFailure = e;
        structuredLogger.logPollLookupFailed(
            predictionId, attempt, consecutiveLookupFailures, e.getMessage());
        if (consecutiveLookupFailures >= maxConsecutiveLookupFailures) {
          throw e;
        }
        pauseBeforeNextAttempt(predictionId, attempt);
        continue;
      }

      structuredLogger.logPollAttempt(
          predictionId, attempt, maxAttempts, String.valueOf(current.status()));

      if (current.isTerminal()) {
        return toOutcome(resolver.resolve(current), attempt);
      }
      pauseBeforeNextAttempt(predictionId, attempt);
    }

    LOGGER.warn("Prediction {} still not terminal after {} polls", predictionId, maxAttempts);
    throw new JobTimeoutException(predictionId, maxAttempts, pollInterval, lastLookupFailure);
  }

  private SyncOutcome toOutcome(Resolution resolution, int attempts) {
    switch (resolution.outcome()) {
      case SUCCEEDED:
        LOGGER.info(
            "Prediction {} resolved after {} polls: {}",
            resolution.predictionId(),
            attempts,
            resolution.resultUrl());
        return new SyncOutcome(resolution.predictionId(), resolution.resultUrl(), attempts);
      case NO_OUTPUT:
        throw new NoOutputException(resolution.predictionId());
      default:
        LOGGER.warn(
            "Prediction {} ended with status {}: {}",
            resolution.predictionId(),
            resolution.providerStatus(),
            resolution.errorMessage());
        throw new PredictionFailedException(
            resolution.predictionId(), resolution.providerStatus(), resolution.errorMessage());
    }
  }

  private void pauseBeforeNextAttempt(String predictionId, int attempt) {
    if (attempt >= maxAttempts) {
      return;
    }
    try {
      pause(pollInterval);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PredictionException("Polling interrupted", predictionId, e);
    }
  }

  /** Wait between polls. */
  protected void pause(Duration interval) throws InterruptedException {
    Thread.sleep(interval.toMillis());
  }
}
