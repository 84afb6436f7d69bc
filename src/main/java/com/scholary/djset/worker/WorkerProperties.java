package com.scholary.djset.worker;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the download-and-split worker.
 *
 * <p>{@code workDir} holds downloads while a job runs; finished tracks are written below {@code
 * outputDir}.
 */
@ConfigurationProperties(prefix = "worker")
@Validated
public record WorkerProperties(
    @NotBlank String workDir,
    @NotBlank String outputDir,
    @NotBlank String ffmpegPath,
    @NotBlank String audioBitrate,
    @NotNull Duration connectTimeout,
    @NotNull Duration downloadTimeout) {}
