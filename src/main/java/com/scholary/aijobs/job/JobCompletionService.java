package com.scholary.aijobs.job;

import com.scholary.aijobs.logging.StructuredLogger;
import com.scholary.aijobs.notification.NotificationDispatcher;
import com.scholary.aijobs.prediction.Prediction;
import com.scholary.aijobs.prediction.PredictionResolver;
import com.scholary.aijobs.prediction.Resolution;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Applies a terminal prediction to its job: persist first, then notify the owner.
 *
 * <p>The notification is only sent when this call actually performed the transition. A repeated
 * delivery of the same terminal event therefore neither rewrites the job nor pushes a second
 * notification.
 */
@Service
public class JobCompletionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobCompletionService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final PredictionResolver resolver;
  private final NotificationDispatcher notificationDispatcher;

  public JobCompletionService(
      JobStore jobStore,
      PredictionResolver resolver,
      NotificationDispatcher notificationDispatcher) {
    this.jobStore = jobStore;
    this.resolver = resolver;
    this.notificationDispatcher = notificationDispatcher;
  }

  /**
   * Resolve a terminal prediction and record the result on the job.
   *
   * @throws IllegalArgumentException if the prediction is not terminal
   */
  public CompletionResult complete(InferenceJob job, Prediction prediction) {
    Resolution resolution = resolver.resolve(prediction);
    JobType type = job.getType();

    switch (resolution.outcome()) {
      case SUCCEEDED:
        return apply(
            job,
            JobStatus.COMPLETED,
            resolution.resultUrl(),
            null,
            String.format("Your %s is ready! Tap to see how it looks.", type.description()));
      case NO_OUTPUT:
        return apply(
            job,
            JobStatus.FAILED,
            null,
            resolution.errorMessage(),
            String.format(
                "Your %s could not be completed. Please try again.", type.description()));
      default:
        return apply(
            job,
            JobStatus.FAILED,
            null,
            resolution.errorMessage(),
            failureBody(type));
    }
  }

  /** Fail a job that will not be resolved by the provider any more. */
  public CompletionResult abandon(InferenceJob job, String errorMessage) {
    return apply(job, JobStatus.FAILED, null, errorMessage, failureBody(job.getType()));
  }

  private CompletionResult apply(
      InferenceJob job,
      JobStatus status,
      String resultUrl,
      String errorMessage,
      String notificationBody) {

    boolean applied = jobStore.markTerminal(job.getJobId(), status, resultUrl, errorMessage);
    if (!applied) {
      InferenceJob stored = jobStore.findById(job.getJobId()).orElse(job);
      LOGGER.info(
          "Job {} already {}, ignoring repeated result for prediction {}",
          job.getJobId(),
          stored.getStatus().wireValue(),
          job.getPredictionId());
      return new CompletionResult(
          job.getJobId(),
          false,
          stored.getStatus(),
          stored.getResultUrl(),
          stored.getErrorMessage());
    }

    structuredLogger.logJobTerminal(
        job.getJobId(), job.getPredictionId(), status.wireValue(), resultUrl, errorMessage);

    // The transition is already committed; a refused push must not undo the acknowledgment.
    try {
      notificationDispatcher.send(
          job.getNotificationToken(),
          notificationTitle(job.getType(), status),
          notificationBody,
          notificationData(job, status, resultUrl));
    } catch (TaskRejectedException e) {
      structuredLogger.logNotificationFailed(
          job.getJobId(), e.getClass().getSimpleName(), e.getMessage());
    }

    return new CompletionResult(job.getJobId(), true, status, resultUrl, errorMessage);
  }

  private static String notificationTitle(JobType type, JobStatus status) {
    return status == JobStatus.COMPLETED ? type.title() + " Ready!" : type.title() + " Failed";
  }

  private static String failureBody(JobType type) {
    return String.format("Your %s encountered an error. Please try again.", type.description());
  }

  private static Map<String, String> notificationData(
      InferenceJob job, JobStatus status, String resultUrl) {
    Map<String, String> data = new LinkedHashMap<>();
    data.put("type", job.getType().wireValue());
    data.put("job_id", job.getJobId());
    data.put("status", status.wireValue());
    data.put("result_url", resultUrl == null ? "" : resultUrl);
    return data;
  }
}
