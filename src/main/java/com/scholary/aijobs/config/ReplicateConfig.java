package com.scholary.aijobs.config;

import com.scholary.aijobs.prediction.ReplicateProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Replicate client.
 *
 * <p>Enables the ReplicateProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ReplicateProperties.class)
public class ReplicateConfig {}
