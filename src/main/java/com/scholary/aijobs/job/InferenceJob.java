package com.scholary.aijobs.job;

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of one asynchronous inference job.
 *
 * <p>Immutable; every state change produces a new instance through the store. Invariants:
 * {@code resultUrl} is set iff the status is {@code COMPLETED}, {@code errorMessage} is set iff
 * the status is {@code FAILED}, and {@code predictionId} never changes.
 */
public final class InferenceJob {

  private final String jobId;
  private final JobType type;
  private final String userId;
  private final String notificationToken;
  private final String predictionId;
  private final Map<String, String> inputs;
  private final JobStatus status;
  private final String resultUrl;
  private final String errorMessage;
  private final Instant createdAt;
  private final Instant updatedAt;

  private InferenceJob(
      String jobId,
      JobType type,
      String userId,
      String notificationToken,
      String predictionId,
      Map<String, String> inputs,
      JobStatus status,
      String resultUrl,
      String errorMessage,
      Instant createdAt,
      Instant updatedAt) {
    this.jobId = jobId;
    this.type = type;
    this.userId = userId;
    this.notificationToken = notificationToken;
    this.predictionId = predictionId;
    this.inputs = inputs;
    this.status = status;
    this.resultUrl = resultUrl;
    this.errorMessage = errorMessage;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
  }

  /**
   * A job that has not been stored yet. The store assigns its id and timestamps.
   *
   * @param inputs references to the job's input assets and text
   */
  public static InferenceJob pending(
      JobType type,
      String userId,
      String notificationToken,
      String predictionId,
      Map<String, String> inputs) {
    if (predictionId == null || predictionId.isBlank()) {
      throw new IllegalArgumentException("predictionId is required");
    }
    return new InferenceJob(
        null,
        type,
        userId,
        notificationToken,
        predictionId,
        Map.copyOf(inputs),
        JobStatus.PROCESSING,
        null,
        null,
        null,
        null);
  }

  InferenceJob created(String jobId, Instant now) {
    return new InferenceJob(
        jobId,
        type,
        userId,
        notificationToken,
        predictionId,
        inputs,
        JobStatus.PROCESSING,
        null,
        null,
        now,
        now);
  }

  InferenceJob terminal(JobStatus newStatus, String newResultUrl, String newErrorMessage, Instant now) {
    checkTerminal(newStatus, newResultUrl, newErrorMessage);
    if (status.isTerminal()) {
      throw new IllegalStateException(
          String.format("Job %s is already %s", jobId, status.wireValue()));
    }
    return new InferenceJob(
        jobId,
        type,
        userId,
        notificationToken,
        predictionId,
        inputs,
        newStatus,
        newResultUrl,
        newErrorMessage,
        createdAt,
        now);
  }

  static void checkTerminal(JobStatus status, String resultUrl, String errorMessage) {
    if (status == null || !status.isTerminal()) {
      throw new IllegalArgumentException("Terminal status required, got " + status);
    }
    if (status == JobStatus.COMPLETED && (resultUrl == null || errorMessage != null)) {
      throw new IllegalArgumentException("A completed job needs a resultUrl and no errorMessage");
    }
    if (status == JobStatus.FAILED && (errorMessage == null || resultUrl != null)) {
      throw new IllegalArgumentException("A failed job needs an errorMessage and no resultUrl");
    }
  }

  public String getJobId() {
    return jobId;
  }

  public JobType getType() {
    return type;
  }

  public String getUserId() {
    return userId;
  }

  public String getNotificationToken() {
    return notificationToken;
  }

  public String getPredictionId() {
    return predictionId;
  }

  public Map<String, String> getInputs() {
    return inputs;
  }

  public JobStatus getStatus() {
    return status;
  }

  public String getResultUrl() {
    return resultUrl;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
