package com.scholary.aijobs.notification;

/**
 * Delivers push notifications to user devices.
 *
 * <p>Implementations make a single delivery attempt and report failure by throwing.
 */
public interface PushSender {

  /**
   * Send one message.
   *
   * @throws NotificationException if the message could not be handed to the push service
   */
  void send(PushMessage message);
}
