package com.scholary.djset.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job lifecycle events with structured fields so that a job's full
 * history can be filtered out of the logs by {@code jobId}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job status transition. */
  public void logJobTransition(String jobId, String from, String to, String message) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("from", from);
      MDC.put("to", to);

      logger.info("Job transition: jobId={}, {} -> {}, message={}", jobId, from, to, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, String stage, double progress, int processedTracks, int totalTracks) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("stage", stage);
      MDC.put("progress", String.valueOf(progress));
      MDC.put("processedTracks", String.valueOf(processedTracks));
      MDC.put("totalTracks", String.valueOf(totalTracks));

      logger.debug(
          "Job progress: jobId={}, stage={}, tracks={}/{}, progress={}%",
          jobId,
          stage,
          processedTracks,
          totalTracks,
          String.format("%.1f", progress * 100));
    } finally {
      clearEventFields();
    }
  }

  /** Log an event from the worker that did not fit the job's current state. */
  public void logProtocolViolation(String jobId, String stage, String reason) {
    try {
      MDC.put("event_type", "protocol_violation");
      MDC.put("stage", stage);

      logger.warn("Protocol violation: jobId={}, stage={}, reason={}", jobId, stage, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a cancellation request and how it was resolved. */
  public void logCancellation(String jobId, String outcome, long waitedMs) {
    try {
      MDC.put("event_type", "job_cancel");
      MDC.put("outcome", outcome);
      MDC.put("waitedMs", String.valueOf(waitedMs));

      logger.info("Job cancel: jobId={}, outcome={}, waited={}ms", jobId, outcome, waitedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceUrl) {
    MDC.put("jobId", jobId);
    MDC.put("sourceUrl", sourceUrl);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceUrl");
  }

  /** Clear event-specific fields from MDC, keeping the job context. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("from");
    MDC.remove("to");
    MDC.remove("stage");
    MDC.remove("progress");
    MDC.remove("processedTracks");
    MDC.remove("totalTracks");
    MDC.remove("outcome");
    MDC.remove("waitedMs");
  }
}
