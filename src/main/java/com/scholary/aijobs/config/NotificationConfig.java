package com.scholary.aijobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.aijobs.notification.HttpPushSender;
import com.scholary.aijobs.notification.LoggingPushSender;
import com.scholary.aijobs.notification.NotificationProperties;
import com.scholary.aijobs.notification.PushSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for push notifications.
 *
 * <p>Wires the HTTP push sender when a gateway endpoint is configured, otherwise a sender that
 * only logs.
 */
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationConfig.class);

  @Bean
  public PushSender pushSender(NotificationProperties properties, ObjectMapper objectMapper) {
    if (!properties.hasEndpoint()) {
      LOGGER.warn("notifications.endpoint is not set; push notifications will only be logged");
      return new LoggingPushSender();
    }
    return new HttpPushSender(properties, objectMapper);
  }
}
