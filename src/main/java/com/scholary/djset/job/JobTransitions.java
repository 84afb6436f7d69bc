package com.scholary.djset.job;

import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import java.util.Optional;

/**
 * The job state machine: decides whether an event may be applied to a job.
 *
 * <pre>
 * initializing -> downloading -> importing -> processing -> complete
 *       \______________\______________\____________\-----> error
 * </pre>
 *
 * <p>An event may keep the job in its current state or move it exactly one step along the success
 * path. An error event is accepted from any non-terminal state. Nothing is accepted once the job is
 * terminal. An event carrying an artifact must be a processing event and must not push the result
 * count past the number of tracks.
 */
public final class JobTransitions {

  private JobTransitions() {}

  /**
   * Check an event against the job's current state. Caller holds the job's lock.
   *
   * @return the reason the event is a protocol violation, or empty if it may be applied
   */
  public static Optional<String> check(Job job, ProgressEvent event) {
    JobStatus current = job.getStatus();
    if (current.isTerminal()) {
      return Optional.of("job is already " + current.wireName());
    }

    Double progress = event.progress();
    if (progress != null && (progress.isNaN() || progress < 0.0 || progress > 1.0)) {
      return Optional.of("progress " + progress + " is outside [0.0, 1.0]");
    }

    if (event.stage() == ProgressStage.ERROR) {
      return Optional.empty();
    }

    JobStatus target = JobStatus.of(event.stage());
    if (target.ordinal() != current.ordinal() && target.ordinal() != current.ordinal() + 1) {
      return Optional.of(
          "illegal transition " + current.wireName() + " -> " + target.wireName());
    }

    if (event.artifact() != null) {
      if (target != JobStatus.PROCESSING) {
        return Optional.of("artifact reported outside the processing stage");
      }
      int totalTracks = job.getTracklist() == null ? 0 : job.getTracklist().size();
      if (job.getResultCount() >= totalTracks) {
        return Optional.of(
            "artifact would exceed the track count of " + totalTracks);
      }
    }

    return Optional.empty();
  }
}
