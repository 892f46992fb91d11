package com.scholary.aijobs.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends push notifications to an HTTP push gateway using the FCM v1 message shape.
 *
 * <p>Android messages go out with high priority on the configured channel; iOS messages play
 * the default sound and set the badge.
 */
public class HttpPushSender implements PushSender {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpPushSender.class);

  private final HttpClient httpClient;
  private final NotificationProperties properties;
  private final ObjectMapper objectMapper;

  public HttpPushSender(NotificationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized push sender: endpoint={}", properties.endpoint());
  }

  @Override
  public void send(PushMessage message) {
    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.endpoint()))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(toPayload(message))));
      if (properties.serverKey() != null && !properties.serverKey().isBlank()) {
        builder.header("Authorization", "Bearer " + properties.serverKey());
      }

      HttpResponse<String> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2) {
        throw new NotificationException(
            String.format(
                "Push gateway returned status %d: %s", response.statusCode(), response.body()));
      }
      LOGGER.debug("Push accepted by gateway: status={}", response.statusCode());

    } catch (IOException e) {
      throw new NotificationException("Failed to reach push gateway", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotificationException("Push send interrupted", e);
    }
  }

  ObjectNode toPayload(PushMessage message) {
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode msg = root.putObject("message");
    msg.put("token", message.token());

    ObjectNode notification = msg.putObject("notification");
    notification.put("title", message.title());
    notification.put("body", message.body());

    ObjectNode data = msg.putObject("data");
    message.data().forEach(data::put);

    ObjectNode android = msg.putObject("android");
    android.put("priority", "high");
    ObjectNode androidNotification = android.putObject("notification");
    androidNotification.put("sound", "default");
    androidNotification.put("channel_id", properties.androidChannelId());

    ObjectNode aps = msg.putObject("apns").putObject("payload").putObject("aps");
    aps.put("sound", "default");
    aps.put("badge", 1);

    return root;
  }
}
