package com.scholary.aijobs.webhook;

import com.scholary.aijobs.job.CompletionResult;
import com.scholary.aijobs.job.InferenceJob;
import com.scholary.aijobs.job.JobCompletionService;
import com.scholary.aijobs.job.JobStore;
import com.scholary.aijobs.logging.StructuredLogger;
import com.scholary.aijobs.prediction.Prediction;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies provider-pushed prediction events to job records.
 *
 * <p>Per event: validate, drop non-terminal statuses, match the job by prediction id, then hand
 * over to {@link JobCompletionService} to persist and notify. Only a structurally invalid event
 * is rejected; an event with no matching job is acknowledged, so stale or foreign deliveries do
 * not set off provider retries.
 */
@Service
public class WebhookHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookHandler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final JobCompletionService completionService;

  public WebhookHandler(JobStore jobStore, JobCompletionService completionService) {
    this.jobStore = jobStore;
    this.completionService = completionService;
  }

  /**
   * Handle one delivery.
   *
   * @throws MalformedWebhookException if the event has no prediction id or no status
   */
  public WebhookAck handle(Prediction event) {
    if (event == null || event.id() == null || event.id().isBlank() || event.status() == null) {
      LOGGER.warn("Malformed webhook payload received");
      throw new MalformedWebhookException("Bad Request: missing id or status.");
    }

    structuredLogger.logWebhookReceived(event.id(), event.status().wireValue());

    if (!event.isTerminal()) {
      return WebhookAck.ignored();
    }

    Optional<InferenceJob> match = jobStore.findByPredictionId(event.id());
    if (match.isEmpty()) {
      LOGGER.warn("No job found for prediction {}", event.id());
      return WebhookAck.unmatched();
    }

    InferenceJob job = match.get();
    StructuredLogger.setJobContext(job.getJobId(), event.id(), job.getUserId());
    try {
      CompletionResult result = completionService.complete(job, event);
      if (!result.applied()) {
        return new WebhookAck(
            WebhookAck.Disposition.DUPLICATE,
            job.getJobId(),
            result.status(),
            "Job already resolved.");
      }
      return new WebhookAck(
          WebhookAck.Disposition.APPLIED, job.getJobId(), result.status(), "Job updated.");
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
