package com.scholary.djset.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job handling.
 *
 * <p>Controls how many jobs run at once, the per-job defaults applied when a submission leaves
 * options out, listing limits, cancellation, the cap on one run's duration and retention.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobProperties(
    @Positive int maxConcurrentJobs,
    @Positive int defaultMaxConcurrentTasks,
    @Positive int maxAllowedConcurrentTasks,
    @Positive int maxPageSize,
    @Positive int maxTracks,
    @NotNull Duration cancelTimeout,
    @NotNull Duration runTimeout,
    @NotNull Duration retention,
    @NotBlank String defaultFileExtension) {}
