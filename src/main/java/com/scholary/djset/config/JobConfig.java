package com.scholary.djset.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for job-related beans.
 *
 * <p>Enables the job and progress properties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({JobProperties.class, ProgressProperties.class})
public class JobConfig {}
