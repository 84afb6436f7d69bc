package com.scholary.djset.worker;

/** Thrown by a worker when it stops because its job was cancelled. */
public class JobCancelledException extends RuntimeException {

  public JobCancelledException() {
    super("Job cancelled");
  }
}
