package com.scholary.aijobs.prediction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Replicate predictions API.
 *
 * <p>Uses the JDK HttpClient with Jackson for the JSON bodies. Nothing is retried here:
 * submission failures go straight back to the caller, and the poll loop decides what to do about
 * failed lookups.
 */
@Component
public class ReplicateClient implements PredictionGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplicateClient.class);

  private static final String PREDICTIONS_PATH = "/v1/predictions";
  private static final int MAX_ERROR_BODY_CHARS = 500;

  private final HttpClient httpClient;
  private final ReplicateProperties properties;
  private final ObjectMapper objectMapper;

  public ReplicateClient(ReplicateProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Replicate client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public Prediction submit(String modelVersion, Map<String, Object> input, String callbackUrl) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("version", modelVersion);
    payload.set("input", objectMapper.valueToTree(input));
    if (callbackUrl != null) {
      payload.put("webhook", callbackUrl);
      // Only the terminal event; start/output/logs events would be noise for us.
      payload.putArray("webhook_events_filter").add("completed");
    }

    try {
      HttpRequest request =
          newRequest(PREDICTIONS_PATH)
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
              .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2) {
        throw new SubmissionException(
            String.format(
                "Replicate rejected prediction: status=%d, body=%s",
                response.statusCode(), truncate(response.body())));
      }

      Prediction prediction = objectMapper.readValue(response.body(), Prediction.class);
      LOGGER.info(
          "Submitted prediction: id={}, version={}, status={}, webhook={}",
          prediction.id(),
          modelVersion,
          prediction.status(),
          callbackUrl != null);
      return prediction;

    } catch (IOException e) {
      throw new SubmissionException("Failed to submit prediction to Replicate", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SubmissionException("Prediction submission interrupted", e);
    }
  }

  @Override
  public Prediction fetch(String predictionId) {
    try {
      HttpRequest request =
          newRequest(
                  PREDICTIONS_PATH
                      + "/"
                      + URLEncoder.encode(predictionId, StandardCharsets.UTF_8))
              .GET()
              .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new LookupException(
            predictionId,
            String.format(
                "Replicate lookup failed: status=%d, body=%s",
                response.statusCode(), truncate(response.body())));
      }

      Prediction prediction = objectMapper.readValue(response.body(), Prediction.class);
      LOGGER.debug("Fetched prediction: id={}, status={}", prediction.id(), prediction.status());
      return prediction;

    } catch (IOException e) {
      throw new LookupException(predictionId, "Failed to fetch prediction from Replicate", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LookupException(predictionId, "Prediction lookup interrupted", e);
    }
  }

  private HttpRequest.Builder newRequest(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + path))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + properties.apiToken())
        .header("Accept", "application/json");
  }

  private static String truncate(String body) {
    if (body == null || body.length() <= MAX_ERROR_BODY_CHARS) {
      return body;
    }
    return body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
  }
}
