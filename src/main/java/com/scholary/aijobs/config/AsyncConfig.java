package com.scholary.aijobs.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for push notifications.
 *
 * <p>The pool is bounded in both threads and queue. Once both are full a push is refused: the
 * refusal is logged here and surfaces to the submitter as a {@code TaskRejectedException}, which
 * callers treat as a failed notification rather than a failed request.
 */
@Configuration
public class AsyncConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncConfig.class);

  public static final String NOTIFICATION_EXECUTOR = "notificationExecutor";

  @Bean(name = NOTIFICATION_EXECUTOR)
  public Executor notificationExecutor(
      @Value("${notifications.executorThreads}") int threads,
      @Value("${notifications.executorQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("notification-");
    executor.setRejectedExecutionHandler(new SaturationHandler(queueSize));
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    executor.initialize();
    return executor;
  }

  static final class SaturationHandler implements RejectedExecutionHandler {

    private final int queueSize;

    SaturationHandler(int queueSize) {
      this.queueSize = queueSize;
    }

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor pool) {
      if (pool.isShutdown()) {
        throw new RejectedExecutionException("Notification executor is shut down");
      }
      LOGGER.warn(
          "Notification executor saturated: active={}, queued={}/{}; refusing push",
          pool.getActiveCount(),
          pool.getQueue().size(),
          queueSize);
      throw new RejectedExecutionException("Notification queue is full");
    }
  }
}
