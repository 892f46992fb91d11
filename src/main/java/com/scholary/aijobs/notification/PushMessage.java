package com.scholary.aijobs.notification;

import java.util.Map;

/** A push notification addressed to one device. */
public record PushMessage(String token, String title, String body, Map<String, String> data) {

  public PushMessage {
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
