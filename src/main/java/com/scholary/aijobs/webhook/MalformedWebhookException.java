package com.scholary.aijobs.webhook;

/** A webhook body that is structurally invalid. The provider should not retry it. */
public class MalformedWebhookException extends RuntimeException {

  public MalformedWebhookException(String message) {
    super(message);
  }

  public MalformedWebhookException(String message, Throwable cause) {
    super(message, cause);
  }
}
