package com.scholary.aijobs.job;

/**
 * Outcome of applying a terminal result to a job.
 *
 * <p>{@code applied} is false when the job had already reached a terminal status, in which case
 * the other fields describe the state that was already stored.
 */
public record CompletionResult(
    String jobId, boolean applied, JobStatus status, String resultUrl, String errorMessage) {}
