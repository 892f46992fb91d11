package com.scholary.aijobs.notification;

import com.scholary.aijobs.config.AsyncConfig;
import com.scholary.aijobs.logging.StructuredLogger;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Best-effort delivery of job results to the owning user's device.
 *
 * <p>Runs on the notification executor, after the job state has been written. One attempt per
 * call, no retries. Failures are logged and never reach the caller: the job record stays the
 * source of truth and clients can still read it directly.
 */
@Component
public class NotificationDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PushSender pushSender;

  public NotificationDispatcher(PushSender pushSender) {
    this.pushSender = pushSender;
  }

  @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
  public void send(String target, String title, String body, Map<String, String> data) {
    String jobId = data == null ? null : data.get("job_id");
    if (target == null || target.isBlank()) {
      LOGGER.info("No notification target for job {}, skipping push", jobId);
      return;
    }

    try {
      pushSender.send(new PushMessage(target, title, body, data));
      LOGGER.info("Notification sent for job {}: {}", jobId, title);
    } catch (RuntimeException e) {
      structuredLogger.logNotificationFailed(jobId, e.getClass().getSimpleName(), e.getMessage());
    }
  }
}
