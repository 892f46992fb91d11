package com.scholary.aijobs.api;

import com.scholary.aijobs.auth.CallerAuthenticator;
import com.scholary.aijobs.job.InferenceJob;
import com.scholary.aijobs.tryon.TryOnService;
import com.scholary.aijobs.tryon.TryOnSubmission;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for virtual try-on.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a try-on (returns job ID immediately, result arrives by push notification)
 *   <li>Job status polling by the owning user
 * </ul>
 */
@RestController
@Tag(name = "Virtual try-on", description = "Asynchronous virtual try-on jobs")
public class TryOnController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TryOnController.class);

  static final String PROCESSING_MESSAGE =
      "Your virtual try-on is processing. You will receive a push notification when it's ready.";

  private final TryOnService tryOnService;
  private final CallerAuthenticator callerAuthenticator;

  public TryOnController(TryOnService tryOnService, CallerAuthenticator callerAuthenticator) {
    this.tryOnService = tryOnService;
    this.callerAuthenticator = callerAuthenticator;
  }

  /** Start an asynchronous try-on job. */
  @PostMapping("/api/try-on")
  @Operation(
      summary = "Start virtual try-on",
      description = "Submit a try-on job and return its job ID; the result is pushed when ready")
  public ResponseEntity<TryOnJobResponse> tryOn(
      HttpServletRequest httpRequest, @Valid @RequestBody TryOnRequest request) {
    String callerId = callerAuthenticator.requireCaller(httpRequest);

    TryOnSubmission submission = tryOnService.submit(callerId, request);
    LOGGER.info("Created async try-on job: {}", submission.jobId());

    return ResponseEntity.accepted()
        .body(new TryOnJobResponse(submission.jobId(), PROCESSING_MESSAGE));
  }

  /** Get job status. */
  @GetMapping("/api/try-on/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a try-on job")
  public ResponseEntity<JobStatusResponse> getJobStatus(
      HttpServletRequest httpRequest, @PathVariable String jobId) {
    String callerId = callerAuthenticator.requireCaller(httpRequest);
    InferenceJob job = tryOnService.findJob(callerId, jobId);
    return ResponseEntity.ok(JobStatusResponse.from(job));
  }
}
