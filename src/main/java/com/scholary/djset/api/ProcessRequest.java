package com.scholary.djset.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to download a DJ set and split it into tracks.
 *
 * <p>{@code fileExtension} and {@code maxConcurrentTasks} are optional; the service defaults apply
 * when they are left out.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessRequest(
    @Schema(description = "HTTP(S) URL of the full set", example = "https://example.com/set.mp3")
        @NotBlank(message = "url is required")
        String url,
    @Schema(
            description = "Tracklist as JSON or as one 'Artist - Title start[-end]' line per track",
            example = "1. Artist A - Track X 00:00-03:30\n2. Artist B - Track Y 03:30-07:00")
        @NotBlank(message = "tracklist is required")
        String tracklist,
    @Schema(description = "Output format: mp3, m4a, wav or flac", example = "mp3")
        String fileExtension,
    @Schema(description = "How many tracks are cut in parallel", example = "4")
        Integer maxConcurrentTasks) {}
