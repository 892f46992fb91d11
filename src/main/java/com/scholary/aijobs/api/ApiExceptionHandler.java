package com.scholary.aijobs.api;

import com.scholary.aijobs.auth.PermissionDeniedException;
import com.scholary.aijobs.auth.UnauthenticatedException;
import com.scholary.aijobs.faceswap.ListingNotFoundException;
import com.scholary.aijobs.faceswap.ListingPreconditionException;
import com.scholary.aijobs.job.JobNotFoundException;
import com.scholary.aijobs.prediction.LookupException;
import com.scholary.aijobs.prediction.NoOutputException;
import com.scholary.aijobs.prediction.PredictionException;
import com.scholary.aijobs.prediction.PredictionFailedException;
import com.scholary.aijobs.prediction.SubmissionException;
import com.scholary.aijobs.sync.JobTimeoutException;
import com.scholary.aijobs.tryon.CallbackUrlNotConfiguredException;
import com.scholary.aijobs.webhook.MalformedWebhookException;
import com.scholary.aijobs.webhook.WebhookSignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to {@link ErrorResponse} bodies with a stable error code.
 *
 * <p>Provider problems are split by kind: could not start (502), model failed (502), model too
 * slow (504) and provider unreachable (503).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException e) {
    return error(HttpStatus.UNAUTHORIZED, "unauthenticated", e.getMessage());
  }

  @ExceptionHandler(PermissionDeniedException.class)
  public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException e) {
    return error(HttpStatus.FORBIDDEN, "permission-denied", e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    FieldError fieldError = e.getBindingResult().getFieldError();
    String message =
        fieldError != null && fieldError.getDefaultMessage() != null
            ? fieldError.getDefaultMessage()
            : "Invalid request.";
    return error(HttpStatus.BAD_REQUEST, "invalid-argument", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return error(
        HttpStatus.BAD_REQUEST, "invalid-argument", "Request body is missing or not valid JSON.");
  }

  @ExceptionHandler({ListingNotFoundException.class, JobNotFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
    return error(HttpStatus.NOT_FOUND, "not-found", e.getMessage());
  }

  @ExceptionHandler(ListingPreconditionException.class)
  public ResponseEntity<ErrorResponse> handlePrecondition(ListingPreconditionException e) {
    return error(HttpStatus.PRECONDITION_FAILED, "failed-precondition", e.getMessage());
  }

  @ExceptionHandler(SubmissionException.class)
  public ResponseEntity<ErrorResponse> handleSubmission(SubmissionException e) {
    LOGGER.error("Prediction submission failed: {}", e.getMessage(), e);
    return error(
        HttpStatus.BAD_GATEWAY, "start-failed", "Failed to start the model. Please try again.");
  }

  @ExceptionHandler({PredictionFailedException.class, NoOutputException.class})
  public ResponseEntity<ErrorResponse> handleJobFailed(PredictionException e) {
    LOGGER.warn("Prediction {} failed: {}", e.getPredictionId(), e.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "job-failed", e.getMessage());
  }

  @ExceptionHandler(JobTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(JobTimeoutException e) {
    LOGGER.warn(
        "Prediction {} timed out after {} polls", e.getPredictionId(), e.getAttempts());
    return error(
        HttpStatus.GATEWAY_TIMEOUT,
        "deadline-exceeded",
        "The model did not complete in time. Please try again.");
  }

  @ExceptionHandler(LookupException.class)
  public ResponseEntity<ErrorResponse> handleLookup(LookupException e) {
    LOGGER.error("Lost contact with provider for prediction {}", e.getPredictionId(), e);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        "provider-unavailable",
        "The AI provider is currently unavailable. Please try again later.");
  }

  @ExceptionHandler(PredictionException.class)
  public ResponseEntity<ErrorResponse> handlePrediction(PredictionException e) {
    LOGGER.error("Prediction {} error", e.getPredictionId(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An internal error occurred.");
  }

  @ExceptionHandler(CallbackUrlNotConfiguredException.class)
  public ResponseEntity<ErrorResponse> handleCallbackUrl(CallbackUrlNotConfiguredException e) {
    LOGGER.error(e.getMessage());
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal",
        "Webhook callback URL is not configured.");
  }

  @ExceptionHandler(MalformedWebhookException.class)
  public ResponseEntity<ErrorResponse> handleMalformedWebhook(MalformedWebhookException e) {
    return error(HttpStatus.BAD_REQUEST, "invalid-argument", e.getMessage());
  }

  @ExceptionHandler(WebhookSignatureException.class)
  public ResponseEntity<ErrorResponse> handleWebhookSignature(WebhookSignatureException e) {
    LOGGER.warn("Rejected webhook delivery: {}", e.getMessage());
    return error(HttpStatus.UNAUTHORIZED, "unauthenticated", "Invalid webhook signature.");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException e) {
    return error(HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed", "Method Not Allowed");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
    LOGGER.error("Unhandled error", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An internal error occurred.");
  }

  private static ResponseEntity<ErrorResponse> error(
      HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(code, message));
  }
}
