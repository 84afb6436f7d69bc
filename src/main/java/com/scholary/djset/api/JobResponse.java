package com.scholary.djset.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.djset.job.JobSnapshot;
import com.scholary.djset.job.JobStatus;
import com.scholary.djset.job.RejectedEvent;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Instant;
import java.util.List;

/**
 * External view of a job.
 *
 * <p>The list endpoint leaves out the event history ({@code events} and {@code rejectedEvents} are
 * null and therefore omitted); the detail endpoint includes it. {@code tracklist} is omitted until
 * the job has reached the importing stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
    String id,
    String url,
    JobStatus status,
    double progress,
    String message,
    String error,
    String fileExtension,
    Integer maxConcurrentTasks,
    Integer totalTracks,
    Tracklist tracklist,
    Instant createdAt,
    Instant startTime,
    Instant endTime,
    List<String> results,
    List<ProgressEvent> events,
    List<RejectedEvent> rejectedEvents) {

  public static JobResponse summary(JobSnapshot job) {
    return from(job, false);
  }

  public static JobResponse detail(JobSnapshot job) {
    return from(job, true);
  }

  private static JobResponse from(JobSnapshot job, boolean withHistory) {
    return new JobResponse(
        job.id(),
        job.sourceUrl(),
        job.status(),
        job.progress(),
        job.message(),
        job.error(),
        job.options().fileExtension(),
        job.options().maxConcurrentTasks(),
        job.tracklist() == null ? null : job.tracklist().size(),
        job.tracklist(),
        job.createdAt(),
        job.startTime(),
        job.endTime(),
        job.results(),
        withHistory ? job.events() : null,
        withHistory ? job.rejectedEvents() : null);
  }
}
