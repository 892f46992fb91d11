package com.scholary.aijobs.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.aijobs.job.MutableClock;
import com.scholary.aijobs.prediction.ReplicateProperties;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookSignatureVerifierTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final String SECRET =
      "whsec_" + Base64.getEncoder().encodeToString("super-secret-key".getBytes(StandardCharsets.UTF_8));
  private static final String BODY = "{\"id\":\"p1\",\"status\":\"succeeded\"}";

  private MutableClock clock;
  private WebhookSignatureVerifier verifier;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    verifier = new WebhookSignatureVerifier(properties(SECRET), clock);
  }

  private static ReplicateProperties properties(String secret) {
    return new ReplicateProperties(
        "https://api.replicate.com",
        "token",
        5,
        5,
        secret,
        new ReplicateProperties.Models("face", "tryon"));
  }

  private String signature(String id, String timestamp, String body) {
    return "v1,"
        + Base64.getEncoder().encodeToString(verifier.sign(id + "." + timestamp + "." + body));
  }

  @Test
  void testValidSignatureIsAccepted() {
    String timestamp = String.valueOf(NOW.getEpochSecond());

    assertThatCode(
            () -> verifier.verify("msg_1", timestamp, signature("msg_1", timestamp, BODY), BODY))
        .doesNotThrowAnyException();
  }

  @Test
  void testAnyMatchingEntryIsAccepted() {
    String timestamp = String.valueOf(NOW.getEpochSecond());
    String header = "v1,AAAA " + signature("msg_1", timestamp, BODY);

    assertThatCode(() -> verifier.verify("msg_1", timestamp, header, BODY))
        .doesNotThrowAnyException();
  }

  @Test
  void testTamperedBodyIsRejected() {
    String timestamp = String.valueOf(NOW.getEpochSecond());
    String header = signature("msg_1", timestamp, BODY);

    assertThatThrownBy(() -> verifier.verify("msg_1", timestamp, header, BODY.replace("p1", "p2")))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void testStaleTimestampIsRejected() {
    String timestamp = String.valueOf(NOW.getEpochSecond());
    String header = signature("msg_1", timestamp, BODY);
    clock.advance(Duration.ofMinutes(6));

    assertThatThrownBy(() -> verifier.verify("msg_1", timestamp, header, BODY))
        .isInstanceOf(WebhookSignatureException.class)
        .hasMessageContaining("tolerance");
  }

  @Test
  void testMissingHeadersAreRejected() {
    assertThatThrownBy(() -> verifier.verify(null, null, null, BODY))
        .isInstanceOf(WebhookSignatureException.class);
    assertThatThrownBy(() -> verifier.verify("msg_1", "not-a-number", "v1,abc", BODY))
        .isInstanceOf(WebhookSignatureException.class);
  }

  @Test
  void testVerificationDisabledWithoutSecret() {
    WebhookSignatureVerifier disabled = new WebhookSignatureVerifier(properties(""), clock);

    assertThat(disabled.isEnabled()).isFalse();
    assertThatCode(() -> disabled.verify(null, null, null, BODY)).doesNotThrowAnyException();
  }
}
