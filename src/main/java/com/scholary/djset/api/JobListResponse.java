package com.scholary.djset.api;

import com.scholary.djset.job.JobPage;
import java.util.List;

/** One page of jobs in submission order. */
public record JobListResponse(
    List<JobResponse> jobs, int page, int pageSize, int totalJobs, int totalPages) {

  public static JobListResponse from(JobPage page) {
    return new JobListResponse(
        page.items().stream().map(JobResponse::summary).toList(),
        page.page(),
        page.pageSize(),
        page.totalJobs(),
        page.totalPages());
  }
}
