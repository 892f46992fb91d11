package com.scholary.aijobs.webhook;

import com.scholary.aijobs.job.JobStatus;

/**
 * How a webhook delivery was handled.
 *
 * <p>Every disposition is acknowledged as success to the provider: none of them would be helped
 * by a retry.
 */
public record WebhookAck(Disposition disposition, String jobId, JobStatus status, String message) {

  public enum Disposition {
    /** Starting/processing event, nothing to do. */
    IGNORED_NON_TERMINAL,
    /** No job is bound to the prediction. */
    UNMATCHED,
    /** The job was moved to a terminal status. */
    APPLIED,
    /** The job was already terminal; nothing changed. */
    DUPLICATE
  }

  static WebhookAck ignored() {
    return new WebhookAck(
        Disposition.IGNORED_NON_TERMINAL, null, null, "Acknowledged. Non-terminal status ignored.");
  }

  static WebhookAck unmatched() {
    return new WebhookAck(Disposition.UNMATCHED, null, null, "No matching job found.");
  }
}
