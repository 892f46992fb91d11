package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.aijobs.webhook.WebhookAck;

/** Body returned to the provider for every acknowledged delivery. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
    boolean success, String message, @JsonProperty("job_id") String jobId, String status) {

  static WebhookAckResponse from(WebhookAck ack) {
    return new WebhookAckResponse(
        true,
        ack.message(),
        ack.jobId(),
        ack.status() == null ? null : ack.status().wireValue());
  }
}
