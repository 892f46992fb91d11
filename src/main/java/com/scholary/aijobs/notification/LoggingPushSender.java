package com.scholary.aijobs.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Push sender for environments without a push gateway: logs the message and drops it. */
public class LoggingPushSender implements PushSender {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingPushSender.class);

  @Override
  public void send(PushMessage message) {
    LOGGER.info(
        "Push (not delivered, no gateway configured): title={}, body={}, data={}",
        message.title(),
        message.body(),
        message.data());
  }
}
