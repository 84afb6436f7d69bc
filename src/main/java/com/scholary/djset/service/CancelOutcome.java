package com.scholary.djset.service;

/** Result of a cancel request. */
public enum CancelOutcome {
  /** The job was running (or queued) and is now terminal with error "cancelled". */
  ACCEPTED,
  /** The job had already finished; nothing changed. */
  ALREADY_TERMINAL
}
