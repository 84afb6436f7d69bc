package com.scholary.djset.worker;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for worker-related beans.
 *
 * <p>Enables the WorkerProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
public class WorkerConfig {}
