package com.scholary.djset.job;

/** Thrown when a job identifier is unknown, or the job has already been evicted. */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
