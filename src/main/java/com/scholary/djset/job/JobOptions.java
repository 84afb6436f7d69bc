package com.scholary.djset.job;

/**
 * Optional per-job settings captured at submission. A null field means "use the service default".
 */
public record JobOptions(String fileExtension, Integer maxConcurrentTasks) {

  public static JobOptions defaults() {
    return new JobOptions(null, null);
  }
}
