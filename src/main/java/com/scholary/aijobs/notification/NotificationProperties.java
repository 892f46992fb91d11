package com.scholary.aijobs.notification;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for push notifications.
 *
 * <p>An empty {@code endpoint} means no push gateway is configured and messages are only logged.
 * Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "notifications")
@Validated
public record NotificationProperties(
    String endpoint,
    String serverKey,
    @NotBlank String androidChannelId,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int executorThreads,
    @Positive int executorQueueSize) {

  public boolean hasEndpoint() {
    return endpoint != null && !endpoint.isBlank();
  }
}
