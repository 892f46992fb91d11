package com.scholary.aijobs.prediction;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Replicate client.
 *
 * <p>The API token comes from the environment. Binding fails at startup when it is missing, since
 * every provider call needs it. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "replicate")
@Validated
public record ReplicateProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiToken,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    String webhookSigningSecret,
    @Valid @NotNull Models models) {

  /** Model version hashes used by the workflows. */
  public record Models(@NotBlank String faceSwap, @NotBlank String tryOn) {}
}
