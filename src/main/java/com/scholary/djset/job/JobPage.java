package com.scholary.djset.job;

import java.util.List;

/** One page of a job listing. {@code pageSize} is the effective, possibly clamped, page size. */
public record JobPage(
    List<JobSnapshot> items, int page, int pageSize, int totalJobs, int totalPages) {}
