package com.scholary.aijobs.webhook;

import com.scholary.aijobs.prediction.ReplicateProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Verifies that a webhook delivery was signed by the provider.
 *
 * <p>Signed content is {@code webhook-id.webhook-timestamp.body}, HMAC-SHA256 with the
 * base64-decoded signing secret (after its {@code whsec_} prefix). The {@code webhook-signature}
 * header lists space-separated {@code v1,<base64>} entries; any match is accepted. Timestamps
 * outside the tolerance window are rejected to limit replays.
 *
 * <p>With no signing secret configured verification is disabled.
 */
@Component
public class WebhookSignatureVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String SECRET_PREFIX = "whsec_";
  private static final String SIGNATURE_VERSION = "v1";
  static final Duration TIMESTAMP_TOLERANCE = Duration.ofMinutes(5);

  private final byte[] secret;
  private final Clock clock;

  public WebhookSignatureVerifier(ReplicateProperties properties, Clock clock) {
    this.clock = clock;
    this.secret = decodeSecret(properties.webhookSigningSecret());
    if (secret == null) {
      LOGGER.warn("replicate.webhookSigningSecret is not set; webhook signatures are NOT verified");
    }
  }

  public boolean isEnabled() {
    return secret != null;
  }

  /**
   * Check a delivery's signature headers against its raw body.
   *
   * @throws WebhookSignatureException if verification is enabled and the delivery fails it
   */
  public void verify(String webhookId, String timestamp, String signatureHeader, String body) {
    if (!isEnabled()) {
      return;
    }
    if (isBlank(webhookId) || isBlank(timestamp) || isBlank(signatureHeader)) {
      throw new WebhookSignatureException("Missing webhook signature headers");
    }

    long epochSeconds;
    try {
      epochSeconds = Long.parseLong(timestamp.trim());
    } catch (NumberFormatException e) {
      throw new WebhookSignatureException("Invalid webhook timestamp");
    }
    long skew = Math.abs(clock.instant().getEpochSecond() - epochSeconds);
    if (skew > TIMESTAMP_TOLERANCE.toSeconds()) {
      throw new WebhookSignatureException("Webhook timestamp outside tolerance");
    }

    byte[] expected = sign(webhookId + "." + timestamp.trim() + "." + (body == null ? "" : body));
    for (String entry : signatureHeader.trim().split("\\s+")) {
      int comma = entry.indexOf(',');
      if (comma < 0 || !SIGNATURE_VERSION.equals(entry.substring(0, comma))) {
        continue;
      }
      byte[] candidate;
      try {
        candidate = Base64.getDecoder().decode(entry.substring(comma + 1));
      } catch (IllegalArgumentException e) {
        continue;
      }
      if (MessageDigest.isEqual(expected, candidate)) {
        return;
      }
    }
    throw new WebhookSignatureException("Webhook signature mismatch");
  }

  byte[] sign(String content) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
      return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }

  private static byte[] decodeSecret(String configured) {
    if (isBlank(configured)) {
      return null;
    }
    String encoded = configured.trim();
    if (encoded.startsWith(SECRET_PREFIX)) {
      encoded = encoded.substring(SECRET_PREFIX.length());
    }
    try {
      return Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("replicate.webhookSigningSecret is not valid base64", e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
