package com.scholary.aijobs.notification;

/** A push notification could not be delivered to the push service. */
public class NotificationException extends RuntimeException {

  public NotificationException(String message) {
    super(message);
  }

  public NotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
