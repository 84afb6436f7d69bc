package com.scholary.djset.job;

import com.scholary.djset.progress.ProgressEvent;

/**
 * A worker event that was not applied because it did not fit the job's state. Kept on the job for
 * diagnostics; never part of the job's event log.
 */
public record RejectedEvent(ProgressEvent event, String reason) {}
