package com.scholary.djset.progress;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of a progress event. Serialized in lower case, e.g. {@code "downloading"}. */
public enum ProgressStage {
  INITIALIZING,
  DOWNLOADING,
  IMPORTING,
  PROCESSING,
  COMPLETE,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
