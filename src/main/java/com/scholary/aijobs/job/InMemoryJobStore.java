package com.scholary.aijobs.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Entries are bounded by size only, never by age: a job has to survive until its webhook
 * arrives, however late. A second map indexes job ids by prediction id so webhook lookups never
 * scan. Terminal transitions are applied with an atomic compute on the entry, so duplicate
 * deliveries racing each other apply at most once.
 */
@Repository
public class InMemoryJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobStore.class);

  private final Cache<String, InferenceJob> jobs;
  private final ConcurrentMap<String, String> jobIdsByPredictionId = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryJobStore(@Value("${jobs.store.maxSize}") int maxSize, Clock clock) {
    this.clock = clock;
    this.jobs =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .removalListener(
                (String jobId, InferenceJob job, RemovalCause cause) -> {
                  if (cause.wasEvicted() && job != null) {
                    jobIdsByPredictionId.remove(job.getPredictionId(), jobId);
                    LOGGER.warn("Evicted job {} ({}) due to store size limit", jobId, cause);
                  }
                })
            .build();
  }

  @Override
  public String create(InferenceJob job) {
    String jobId = UUID.randomUUID().toString();
    String existing = jobIdsByPredictionId.putIfAbsent(job.getPredictionId(), jobId);
    if (existing != null) {
      throw new IllegalStateException(
          String.format(
              "Prediction %s is already bound to job %s", job.getPredictionId(), existing));
    }
    jobs.put(jobId, job.created(jobId, clock.instant()));
    LOGGER.debug("Created job {} for prediction {}", jobId, job.getPredictionId());
    return jobId;
  }

  @Override
  public Optional<InferenceJob> findById(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }

  @Override
  public Optional<InferenceJob> findByPredictionId(String predictionId) {
    String jobId = jobIdsByPredictionId.get(predictionId);
    if (jobId == null) {
      return Optional.empty();
    }
    return findById(jobId);
  }

  @Override
  public boolean markTerminal(
      String jobId, JobStatus status, String resultUrl, String errorMessage) {
    InferenceJob.checkTerminal(status, resultUrl, errorMessage);

    AtomicBoolean applied = new AtomicBoolean(false);
    jobs.asMap()
        .computeIfPresent(
            jobId,
            (id, current) -> {
              if (current.getStatus().isTerminal()) {
                return current;
              }
              applied.set(true);
              return current.terminal(status, resultUrl, errorMessage, clock.instant());
            });

    if (!applied.get()) {
      LOGGER.debug("Terminal transition for job {} not applied (missing or already terminal)", jobId);
    }
    return applied.get();
  }

  @Override
  public List<InferenceJob> findProcessingOlderThan(Instant cutoff, int limit) {
    return jobs.asMap().values().stream()
        .filter(job -> job.getStatus() == JobStatus.PROCESSING)
        .filter(job -> job.getCreatedAt().isBefore(cutoff))
        .sorted(Comparator.comparing(InferenceJob::getCreatedAt))
        .limit(limit)
        .collect(Collectors.toList());
  }
}
