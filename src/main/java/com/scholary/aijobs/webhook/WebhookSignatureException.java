package com.scholary.aijobs.webhook;

/** A webhook delivery failed signature verification. */
public class WebhookSignatureException extends RuntimeException {

  public WebhookSignatureException(String message) {
    super(message);
  }
}
