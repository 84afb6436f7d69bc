package com.scholary.djset.job;

import com.fasterxml.jackson.annotation.JsonValue;
import com.scholary.djset.progress.ProgressStage;

/**
 * Lifecycle state of a job.
 *
 * <p>Declared in success-path order; {@link #ERROR} is reachable from every non-terminal state.
 * A job's status is always the status of its latest progress event's stage.
 */
public enum JobStatus {
  INITIALIZING,
  DOWNLOADING,
  IMPORTING,
  PROCESSING,
  COMPLETE,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  public static JobStatus of(ProgressStage stage) {
    return switch (stage) {
      case INITIALIZING -> INITIALIZING;
      case DOWNLOADING -> DOWNLOADING;
      case IMPORTING -> IMPORTING;
      case PROCESSING -> PROCESSING;
      case COMPLETE -> COMPLETE;
      case ERROR -> ERROR;
    };
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
