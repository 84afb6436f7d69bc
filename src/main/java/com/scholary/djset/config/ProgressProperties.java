package com.scholary.djset.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for progress streaming.
 *
 * <p>{@code subscriberBuffer} is the number of undelivered events a live subscriber may lag
 * behind before it is disconnected. {@code streamTimeout} bounds the lifetime of one server-sent
 * event stream.
 */
@ConfigurationProperties(prefix = "progress")
@Validated
public record ProgressProperties(@Positive int subscriberBuffer, @NotNull Duration streamTimeout) {}
