package com.scholary.djset.progress;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;

/**
 * One immutable fact in a job's history.
 *
 * <p>Only {@code timestamp} and {@code stage} are mandatory. {@code error} is only allowed on
 * {@link ProgressStage#ERROR} events. {@code artifact} is set by per-track completion events and
 * carries the location of the file that was produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    Instant timestamp,
    ProgressStage stage,
    Double progress,
    String message,
    String error,
    TrackDetails trackDetails,
    byte[] data,
    String artifact) {

  public ProgressEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(stage, "stage");
    if (error != null && stage != ProgressStage.ERROR) {
      throw new IllegalArgumentException("error is only allowed on error events, got " + stage);
    }
  }

  public static ProgressEvent of(ProgressStage stage, Double progress, String message) {
    return new ProgressEvent(Instant.now(), stage, progress, message, null, null, null, null);
  }

  public static ProgressEvent error(String message, String error) {
    return new ProgressEvent(
        Instant.now(), ProgressStage.ERROR, null, message, error, null, null, null);
  }

  public static ProgressEvent trackCompleted(
      double progress, String message, TrackDetails trackDetails, String artifact) {
    return new ProgressEvent(
        Instant.now(),
        ProgressStage.PROCESSING,
        progress,
        message,
        null,
        trackDetails,
        null,
        artifact);
  }

  public ProgressEvent withTimestamp(Instant newTimestamp) {
    return new ProgressEvent(
        newTimestamp, stage, progress, message, error, trackDetails, data, artifact);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return stage.isTerminal();
  }
}
