package com.scholary.aijobs.reconcile;

import com.scholary.aijobs.config.JobsProperties;
import com.scholary.aijobs.job.CompletionResult;
import com.scholary.aijobs.job.InferenceJob;
import com.scholary.aijobs.job.JobCompletionService;
import com.scholary.aijobs.job.JobStore;
import com.scholary.aijobs.logging.StructuredLogger;
import com.scholary.aijobs.prediction.LookupException;
import com.scholary.aijobs.prediction.Prediction;
import com.scholary.aijobs.prediction.PredictionGateway;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recovers async jobs whose webhook never arrived.
 *
 * <p>Each sweep picks up {@code processing} jobs older than {@code staleAfter}, asks the provider
 * for their prediction and completes the ones that have finished. Jobs still unresolved after
 * {@code abandonAfter} are failed. A lookup failure leaves the job for the next sweep.
 */
@Component
public class StaleJobReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobReconciler.class);

  static final String ABANDONED_MESSAGE =
      "The try-on did not complete in time. Please try again.";

  private final JobStore jobStore;
  private final PredictionGateway gateway;
  private final JobCompletionService completionService;
  private final Clock clock;
  private final JobsProperties.ReconcileProperties properties;

  private final AtomicBoolean running = new AtomicBoolean(false);

  public StaleJobReconciler(
      JobStore jobStore,
      PredictionGateway gateway,
      JobCompletionService completionService,
      Clock clock,
      JobsProperties jobsProperties) {
    this.jobStore = jobStore;
    this.gateway = gateway;
    this.completionService = completionService;
    this.clock = clock;
    this.properties = jobsProperties.reconcile();
  }

  @Scheduled(
      initialDelayString = "${jobs.reconcile.interval}",
      fixedDelayString = "${jobs.reconcile.interval}")
  public void reconcile() {
    if (!properties.enabled()) {
      return;
    }
    if (!running.compareAndSet(false, true)) {
      return;
    }
    try {
      ReconcileSummary summary = reconcileOnce();
      if (summary.examined() > 0) {
        LOGGER.info(
            "Reconcile sweep: examined={}, completed={}, abandoned={}, lookupFailures={}",
            summary.examined(),
            summary.completed(),
            summary.abandoned(),
            summary.lookupFailures());
      }
    } catch (RuntimeException e) {
      LOGGER.error("Reconcile sweep failed", e);
    } finally {
      running.set(false);
    }
  }

  /** Run a single sweep and report what it did. */
  public ReconcileSummary reconcileOnce() {
    Instant now = clock.instant();
    List<InferenceJob> stale =
        jobStore.findProcessingOlderThan(now.minus(properties.staleAfter()), properties.batchSize());
    if (stale.isEmpty()) {
      return ReconcileSummary.empty();
    }

    int completed = 0;
    int abandoned = 0;
    int lookupFailures = 0;

    for (InferenceJob job : stale) {
      StructuredLogger.setJobContext(job.getJobId(), job.getPredictionId(), job.getUserId());
      try {
        Prediction prediction = gateway.fetch(job.getPredictionId());
        if (prediction.isTerminal()) {
          CompletionResult result = completionService.complete(job, prediction);
          if (result.applied()) {
            completed++;
          }
        } else if (isAbandoned(job, now)) {
          abandoned += abandon(job);
        }
      } catch (LookupException e) {
        lookupFailures++;
        LOGGER.warn(
            "Could not look up prediction {} for job {}: {}",
            job.getPredictionId(),
            job.getJobId(),
            e.getMessage());
        if (isAbandoned(job, now)) {
          abandoned += abandon(job);
        }
      } catch (RuntimeException e) {
        LOGGER.error("Reconcile of job {} failed; continuing sweep", job.getJobId(), e);
      } finally {
        StructuredLogger.clearJobContext();
      }
    }

    return new ReconcileSummary(stale.size(), completed, abandoned, lookupFailures);
  }

  private boolean isAbandoned(InferenceJob job, Instant now) {
    Duration age = Duration.between(job.getCreatedAt(), now);
    return age.compareTo(properties.abandonAfter()) >= 0;
  }

  private int abandon(InferenceJob job) {
    LOGGER.warn(
        "Abandoning job {} after {}; prediction {} never resolved",
        job.getJobId(),
        properties.abandonAfter(),
        job.getPredictionId());
    return completionService.abandon(job, ABANDONED_MESSAGE).applied() ? 1 : 0;
  }
}
