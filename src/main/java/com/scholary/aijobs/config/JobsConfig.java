package com.scholary.aijobs.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for job orchestration beans.
 *
 * <p>Enables JobsProperties and exposes the clock used to stamp job records.
 */
@Configuration
@EnableConfigurationProperties(JobsProperties.class)
public class JobsConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
