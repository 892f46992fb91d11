package com.scholary.aijobs.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for asynchronous jobs.
 *
 * <p>The store is the single source of truth for the webhook path. After creation the only
 * permitted write is {@link #markTerminal}.
 */
public interface JobStore {

  /**
   * Store a new job with a fresh id, status {@code processing} and creation timestamps.
   *
   * @return the assigned job id
   * @throws IllegalStateException if another job is already bound to the same prediction
   */
  String create(InferenceJob job);

  Optional<InferenceJob> findById(String jobId);

  /**
   * Find the job correlated with a prediction. Must be backed by an equality index.
   *
   * <p>An empty result is a normal outcome (stale delivery, other environment, early webhook).
   */
  Optional<InferenceJob> findByPredictionId(String predictionId);

  /**
   * Move a job from {@code processing} to a terminal status and stamp {@code updatedAt}.
   *
   * @return {@code true} if the transition was applied, {@code false} if the job was already
   *     terminal or does not exist
   * @throws IllegalArgumentException if status, resultUrl and errorMessage break the job
   *     invariants
   */
  boolean markTerminal(String jobId, JobStatus status, String resultUrl, String errorMessage);

  /** Jobs still {@code processing} that were created before the cutoff, oldest first. */
  List<InferenceJob> findProcessingOlderThan(Instant cutoff, int limit);
}
