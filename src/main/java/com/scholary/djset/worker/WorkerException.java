package com.scholary.djset.worker;

/**
 * Exception thrown when downloading or cutting a set fails.
 *
 * <p>This could be an unreachable source, an ffmpeg failure, or a local I/O problem. The message
 * ends up as the job's error, so it should be readable by the person who submitted the job.
 */
public class WorkerException extends RuntimeException {

  public WorkerException(String message) {
    super(message);
  }

  public WorkerException(String message, Throwable cause) {
    super(message, cause);
  }
}
