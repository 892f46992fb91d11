package com.scholary.aijobs.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.aijobs.config.AsyncConfig;
import com.scholary.aijobs.job.InMemoryJobStore;
import com.scholary.aijobs.job.InferenceJob;
import com.scholary.aijobs.job.JobCompletionService;
import com.scholary.aijobs.job.JobStatus;
import com.scholary.aijobs.job.JobType;
import com.scholary.aijobs.job.MutableClock;
import com.scholary.aijobs.notification.NotificationDispatcher;
import com.scholary.aijobs.notification.PushMessage;
import com.scholary.aijobs.notification.PushSender;
import com.scholary.aijobs.prediction.PredictionResolver;
import com.scholary.aijobs.prediction.ReplicateProperties;
import com.scholary.aijobs.prediction.ScriptedPredictionGateway;
import com.scholary.aijobs.webhook.WebhookHandler;
import com.scholary.aijobs.webhook.WebhookPaths;
import com.scholary.aijobs.webhook.WebhookSignatureVerifier;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Webhook deliveries against a real async notification pool with one thread and a queue of one.
 */
class WebhookNotificationSaturationTest {

  private AnnotationConfigApplicationContext context;
  private GatedPushSender pushSender;
  private InMemoryJobStore jobStore;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    context = new AnnotationConfigApplicationContext(SaturatedNotifications.class);
    pushSender = context.getBean(GatedPushSender.class);

    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    jobStore = new InMemoryJobStore(100, clock);
    JobCompletionService completionService =
        new JobCompletionService(
            jobStore,
            new PredictionResolver(new ScriptedPredictionGateway()),
            context.getBean(NotificationDispatcher.class));
    ReplicateProperties properties =
        new ReplicateProperties(
            "https://api.replicate.com",
            "token",
            5,
            5,
            null,
            new ReplicateProperties.Models("face", "tryon"));
    WebhookController controller =
        new WebhookController(
            new WebhookHandler(jobStore, completionService),
            new WebhookSignatureVerifier(properties, clock),
            new ObjectMapper());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @AfterEach
  void tearDown() {
    pushSender.release();
    context.close();
  }

  @Test
  void testEveryDeliveryIsAcknowledgedWhenPushesAreRefused() throws Exception {
    String[] jobIds = new String[3];
    for (int i = 0; i < jobIds.length; i++) {
      jobIds[i] =
          jobStore.create(
              InferenceJob.pending(
                  JobType.VIRTUAL_TRY_ON, "user-" + i, "token-" + i, "p" + i, Map.of()));
    }

    // first push holds the only thread, second fills the queue, third is refused
    for (int i = 0; i < jobIds.length; i++) {
      mockMvc
          .perform(
              post(WebhookPaths.REPLICATE)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"id\":\"p" + i + "\",\"status\":\"succeeded\","
                          + "\"output\":\"https://cdn/r" + i + ".png\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.message").value("Job updated."));
    }

    for (String jobId : jobIds) {
      assertThat(jobStore.findById(jobId).orElseThrow().getStatus())
          .isEqualTo(JobStatus.COMPLETED);
    }

    pushSender.release();
    assertThat(pushSender.awaitDeliveries(2)).isTrue();
    context.close();
    assertThat(pushSender.delivered()).containsExactly(jobIds[0], jobIds[1]);
  }

  @Configuration
  @EnableAsync
  static class SaturatedNotifications {

    @Bean(name = AsyncConfig.NOTIFICATION_EXECUTOR)
    Executor notificationExecutor() {
      return new AsyncConfig().notificationExecutor(1, 1);
    }

    @Bean
    GatedPushSender gatedPushSender() {
      return new GatedPushSender();
    }

    @Bean
    NotificationDispatcher notificationDispatcher(PushSender pushSender) {
      return new NotificationDispatcher(pushSender);
    }
  }

  /** Holds every push until released, then records the job id it carried. */
  static final class GatedPushSender implements PushSender {

    private final CountDownLatch gate = new CountDownLatch(1);
    private final CountDownLatch deliveries = new CountDownLatch(2);
    private final List<String> delivered = new CopyOnWriteArrayList<>();

    @Override
    public void send(PushMessage message) {
      try {
        gate.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      delivered.add(message.data().get("job_id"));
      deliveries.countDown();
    }

    void release() {
      gate.countDown();
    }

    boolean awaitDeliveries(int expected) throws InterruptedException {
      return deliveries.await(5, TimeUnit.SECONDS) && delivered.size() >= expected;
    }

    List<String> delivered() {
      return delivered;
    }
  }
}
