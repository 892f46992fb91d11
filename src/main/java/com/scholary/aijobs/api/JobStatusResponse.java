package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.aijobs.job.InferenceJob;
import java.time.Instant;

/**
 * Job status for the owning user.
 *
 * <p>{@code result_url} is present only for completed jobs, {@code error_message} only for failed
 * ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    @JsonProperty("job_id") String jobId,
    String type,
    String status,
    @JsonProperty("result_url") String resultUrl,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  public static JobStatusResponse from(InferenceJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getType().wireValue(),
        job.getStatus().wireValue(),
        job.getResultUrl(),
        job.getErrorMessage(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
