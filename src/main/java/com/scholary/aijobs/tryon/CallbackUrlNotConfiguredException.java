package com.scholary.aijobs.tryon;

/** Webhook-based submission was requested but no public callback base URL is configured. */
public class CallbackUrlNotConfiguredException extends RuntimeException {

  public CallbackUrlNotConfiguredException() {
    super("jobs.callbackBaseUrl is not configured; cannot submit webhook-based predictions");
  }
}
