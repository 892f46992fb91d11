package com.scholary.aijobs.tryon;

import com.scholary.aijobs.api.TryOnRequest;
import com.scholary.aijobs.auth.PermissionDeniedException;
import com.scholary.aijobs.config.JobsProperties;
import com.scholary.aijobs.job.InferenceJob;
import com.scholary.aijobs.job.JobNotFoundException;
import com.scholary.aijobs.job.JobStore;
import com.scholary.aijobs.job.JobType;
import com.scholary.aijobs.logging.StructuredLogger;
import com.scholary.aijobs.prediction.Prediction;
import com.scholary.aijobs.prediction.PredictionGateway;
import com.scholary.aijobs.prediction.ReplicateProperties;
import com.scholary.aijobs.webhook.WebhookPaths;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Virtual try-on: submit a webhook-based prediction and hand back a job id straight away.
 *
 * <p>The job record is written only after the provider has accepted the prediction, so every
 * stored job carries a prediction id. Completion is driven by the webhook path.
 */
@Service
public class TryOnService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TryOnService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PredictionGateway gateway;
  private final JobStore jobStore;
  private final String modelVersion;
  private final String callbackBaseUrl;

  public TryOnService(
      PredictionGateway gateway,
      JobStore jobStore,
      ReplicateProperties replicateProperties,
      JobsProperties jobsProperties) {
    this.gateway = gateway;
    this.jobStore = jobStore;
    this.modelVersion = replicateProperties.models().tryOn();
    this.callbackBaseUrl = jobsProperties.callbackBaseUrl();
  }

  /**
   * Start a try-on for the caller.
   *
   * @throws CallbackUrlNotConfiguredException if there is nowhere for the provider to call back
   * @throws com.scholary.aijobs.prediction.SubmissionException if the provider rejects the job
   */
  public TryOnSubmission submit(String callerId, TryOnRequest request) {
    String callbackUrl = callbackUrl();

    Map<String, Object> input = new LinkedHashMap<>();
    input.put("human_img", request.userImageUrl());
    input.put("garm_img", request.garmentImageUrl());
    input.put("garment_des", request.garmentDescription());
    input.put("is_checked", true);
    input.put("is_checked_crop", false);
    input.put("denoise_steps", 30);
    input.put("seed", 42);

    Prediction prediction = gateway.submit(modelVersion, input, callbackUrl);
    structuredLogger.logPredictionSubmitted(prediction.id(), modelVersion, true);

    Map<String, String> inputs = new LinkedHashMap<>();
    inputs.put("user_image_url", request.userImageUrl());
    inputs.put("garment_image_url", request.garmentImageUrl());
    inputs.put("garment_description", request.garmentDescription());

    String jobId =
        jobStore.create(
            InferenceJob.pending(
                JobType.VIRTUAL_TRY_ON, callerId, request.fcmToken(), prediction.id(), inputs));

    LOGGER.info(
        "Try-on job {} created for user {}: prediction={}", jobId, callerId, prediction.id());
    return new TryOnSubmission(jobId, prediction.id());
  }

  /**
   * Look up one of the caller's jobs.
   *
   * @throws JobNotFoundException if no such job exists
   * @throws PermissionDeniedException if the job belongs to someone else
   */
  public InferenceJob findJob(String callerId, String jobId) {
    InferenceJob job = jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (!callerId.equals(job.getUserId())) {
      throw new PermissionDeniedException("You can only view your own try-on jobs.");
    }
    return job;
  }

  private String callbackUrl() {
    if (callbackBaseUrl == null || callbackBaseUrl.isBlank()) {
      throw new CallbackUrlNotConfiguredException();
    }
    String base =
        callbackBaseUrl.endsWith("/")
            ? callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1)
            : callbackBaseUrl;
    return base + WebhookPaths.REPLICATE;
  }
}
