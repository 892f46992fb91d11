package com.scholary.aijobs.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its own fields so job lifecycles can be queried
 * in the log backend by {@code jobId} or {@code predictionId}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log prediction submitted event. */
  public void logPredictionSubmitted(String predictionId, String modelVersion, boolean webhook) {
    try {
      MDC.put("event_type", "prediction_submitted");
      MDC.put("webhook", String.valueOf(webhook));

      logger.info(
          "Prediction submitted: predictionId={}, version={}, webhook={}",
          predictionId,
          modelVersion,
          webhook);
    } finally {
      clearEventFields();
    }
  }

  /** Log poll attempt event. */
  public void logPollAttempt(String predictionId, int attempt, int maxAttempts, String status) {
    try {
      MDC.put("event_type", "poll_attempt");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("status", status);

      logger.debug(
          "Poll attempt: predictionId={}, attempt={}/{}, status={}",
          predictionId,
          attempt,
          maxAttempts,
          status);
    } finally {
      clearEventFields();
    }
  }

  /** Log poll lookup failure event. */
  public void logPollLookupFailed(
      String predictionId, int attempt, int consecutiveFailures, String message) {
    try {
      MDC.put("event_type", "poll_lookup_failed");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("consecutiveFailures", String.valueOf(consecutiveFailures));

      logger.warn(
          "Poll lookup failed: predictionId={}, attempt={}, consecutiveFailures={}, message={}",
          predictionId,
          attempt,
          consecutiveFailures,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job terminal transition event. */
  public void logJobTerminal(
      String jobId, String predictionId, String status, String resultUrl, String errorMessage) {
    try {
      MDC.put("event_type", "job_terminal");
      MDC.put("status", status);

      logger.info(
          "Job terminal: jobId={}, predictionId={}, status={}, resultUrl={}, error={}",
          jobId,
          predictionId,
          status,
          resultUrl,
          errorMessage);
    } finally {
      clearEventFields();
    }
  }

  /** Log webhook received event. */
  public void logWebhookReceived(String predictionId, String status) {
    try {
      MDC.put("event_type", "webhook_received");
      MDC.put("status", status);

      logger.info("Webhook received: predictionId={}, status={}", predictionId, status);
    } finally {
      clearEventFields();
    }
  }

  /** Log notification failure event. */
  public void logNotificationFailed(String jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "notification_failed");
      MDC.put("errorType", errorType);

      logger.error(
          "Notification failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String predictionId, String userId) {
    putIfPresent("jobId", jobId);
    putIfPresent("predictionId", predictionId);
    putIfPresent("userId", userId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("predictionId");
    MDC.remove("userId");
  }

  private static void putIfPresent(String key, String value) {
    if (value != null) {
      MDC.put(key, value);
    }
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("webhook");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("status");
    MDC.remove("consecutiveFailures");
    MDC.remove("errorType");
  }
}
