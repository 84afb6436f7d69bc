package com.scholary.djset.job;

import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A submitted download-and-split job and its tracked state.
 *
 * <p>Instances live in {@link JobRegistry} and are only mutated while holding the job's own lock,
 * through {@link JobRegistry#update} or {@link JobRegistry#appendEvent}. Readers get a {@link
 * JobSnapshot}.
 */
public class Job {

  private final String id;
  private final long sequence;
  private final String sourceUrl;
  private final String tracklistRaw;
  private final JobOptions options;
  private final Instant createdAt;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile JobStatus status;
  private Instant startTime;
  private Instant endTime;
  private double progress;
  private String message;
  private String error;
  private Tracklist tracklist;
  private Instant lastEventTime;
  private final List<String> results = new ArrayList<>();
  private final List<RejectedEvent> rejectedEvents = new ArrayList<>();

  Job(
      String id,
      long sequence,
      String sourceUrl,
      String tracklistRaw,
      JobOptions options,
      Instant createdAt) {
    this.id = id;
    this.sequence = sequence;
    this.sourceUrl = sourceUrl;
    this.tracklistRaw = tracklistRaw;
    this.options = options;
    this.createdAt = createdAt;
    this.status = JobStatus.INITIALIZING;
    this.message = "Job created";
  }

  ReentrantLock lock() {
    return lock;
  }

  /**
   * Refresh the projection from an event that already passed {@link JobTransitions#check}.
   *
   * <p>The summarized progress only moves forward; the event itself keeps whatever the worker
   * reported.
   */
  void apply(ProgressEvent event) {
    JobStatus next = JobStatus.of(event.stage());
    if (status == JobStatus.INITIALIZING && next != JobStatus.INITIALIZING && !next.isTerminal()) {
      startTime = event.timestamp();
    }
    status = next;
    lastEventTime = event.timestamp();

    if (event.message() != null) {
      message = event.message();
    }
    if (event.progress() != null) {
      progress = Math.max(progress, event.progress());
    }
    if (event.artifact() != null) {
      results.add(event.artifact());
    }

    if (event.stage() == ProgressStage.COMPLETE) {
      progress = 1.0;
      endTime = event.timestamp();
    } else if (event.stage() == ProgressStage.ERROR) {
      error = event.error() != null ? event.error() : message;
      endTime = event.timestamp();
    }
  }

  void recordRejected(RejectedEvent rejected) {
    rejectedEvents.add(rejected);
  }

  /** Attach the parsed tracklist once; later calls are ignored. */
  public void attachTracklist(Tracklist parsed) {
    if (tracklist == null) {
      tracklist = parsed;
    }
  }

  JobSnapshot snapshot(List<ProgressEvent> events) {
    return new JobSnapshot(
        id,
        sequence,
        sourceUrl,
        tracklistRaw,
        options,
        status,
        createdAt,
        startTime,
        endTime,
        progress,
        message,
        error,
        tracklist,
        List.copyOf(results),
        events,
        List.copyOf(rejectedEvents));
  }

  public String getId() {
    return id;
  }

  public long getSequence() {
    return sequence;
  }

  public JobStatus getStatus() {
    return status;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public Tracklist getTracklist() {
    return tracklist;
  }

  public int getResultCount() {
    return results.size();
  }

  public double getProgress() {
    return progress;
  }

  Instant getLastEventTime() {
    return lastEventTime;
  }
}
