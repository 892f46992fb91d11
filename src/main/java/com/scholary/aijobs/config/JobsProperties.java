package com.scholary.aijobs.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job orchestration.
 *
 * <p>{@code callbackBaseUrl} may be empty at startup; webhook-based submissions then fail fast
 * instead of silently falling back to polling.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobsProperties(
    String callbackBaseUrl,
    @Valid @NotNull SyncProperties sync,
    @Valid @NotNull ReconcileProperties reconcile) {

  public record SyncProperties(
      @NotNull Duration pollInterval,
      @Positive int maxAttempts,
      @Positive int maxConsecutiveLookupFailures) {}

  public record ReconcileProperties(
      boolean enabled,
      @NotNull Duration interval,
      @NotNull Duration staleAfter,
      @NotNull Duration abandonAfter,
      @Positive int batchSize) {}
}
