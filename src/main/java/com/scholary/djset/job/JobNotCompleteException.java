package com.scholary.djset.job;

/** Thrown when a job's tracks are requested before the job has completed. */
public class JobNotCompleteException extends InvalidRequestException {

  public JobNotCompleteException(String jobId) {
    super("Job is not completed yet: " + jobId);
  }
}
