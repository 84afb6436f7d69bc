package com.scholary.djset.job;

import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Instant;
import java.util.List;

/**
 * Immutable, consistent copy of a job taken under the job's lock.
 *
 * <p>{@code startTime}, {@code endTime}, {@code error} and {@code tracklist} are null until set.
 */
public record JobSnapshot(
    String id,
    long sequence,
    String sourceUrl,
    String tracklistRaw,
    JobOptions options,
    JobStatus status,
    Instant createdAt,
    Instant startTime,
    Instant endTime,
    double progress,
    String message,
    String error,
    Tracklist tracklist,
    List<String> results,
    List<ProgressEvent> events,
    List<RejectedEvent> rejectedEvents) {

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
