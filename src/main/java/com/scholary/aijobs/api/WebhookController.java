package com.scholary.aijobs.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.aijobs.prediction.Prediction;
import com.scholary.aijobs.webhook.MalformedWebhookException;
import com.scholary.aijobs.webhook.WebhookAck;
import com.scholary.aijobs.webhook.WebhookHandler;
import com.scholary.aijobs.webhook.WebhookPaths;
import com.scholary.aijobs.webhook.WebhookSignatureVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives prediction events pushed by Replicate.
 *
 * <p>The body is read raw so the signature can be checked over the exact bytes that were signed.
 * Anything short of a malformed or unauthenticated delivery is answered with 200.
 */
@RestController
@Tag(name = "Webhooks", description = "Provider callbacks")
public class WebhookController {

  private final WebhookHandler webhookHandler;
  private final WebhookSignatureVerifier signatureVerifier;
  private final ObjectMapper objectMapper;

  public WebhookController(
      WebhookHandler webhookHandler,
      WebhookSignatureVerifier signatureVerifier,
      ObjectMapper objectMapper) {
    this.webhookHandler = webhookHandler;
    this.signatureVerifier = signatureVerifier;
    this.objectMapper = objectMapper;
  }

  @PostMapping(WebhookPaths.REPLICATE)
  @Operation(
      summary = "Replicate prediction webhook",
      description = "Apply a terminal prediction event to its job and notify the owner")
  public ResponseEntity<WebhookAckResponse> replicate(
      @RequestHeader(name = "webhook-id", required = false) String webhookId,
      @RequestHeader(name = "webhook-timestamp", required = false) String webhookTimestamp,
      @RequestHeader(name = "webhook-signature", required = false) String webhookSignature,
      @RequestBody(required = false) String body) {

    signatureVerifier.verify(webhookId, webhookTimestamp, webhookSignature, body);

    WebhookAck ack = webhookHandler.handle(parse(body));
    return ResponseEntity.ok(WebhookAckResponse.from(ack));
  }

  private Prediction parse(String body) {
    if (body == null || body.isBlank()) {
      throw new MalformedWebhookException("Bad Request: empty body.");
    }
    try {
      return objectMapper.readValue(body, Prediction.class);
    } catch (JsonProcessingException e) {
      throw new MalformedWebhookException("Bad Request: invalid JSON payload.", e);
    }
  }
}
