package com.scholary.aijobs.webhook;

/** Public paths the provider delivers webhooks to. */
public final class WebhookPaths {

  public static final String REPLICATE = "/webhooks/replicate";

  private WebhookPaths() {}
}
