package com.scholary.djset.job;

import com.scholary.djset.config.JobProperties;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Serves ordered, paged views over a set of jobs.
 *
 * <p>Jobs are ordered by creation, ties broken by identifier. Pages are 1-based. A page past the
 * end is empty but still reports accurate totals.
 */
@Component
public class Paginator {

  private static final Comparator<JobSnapshot> CREATION_ORDER =
      Comparator.comparingLong(JobSnapshot::sequence).thenComparing(JobSnapshot::id);

  private final int maxPageSize;

  public Paginator(JobProperties properties) {
    this.maxPageSize = properties.maxPageSize();
  }

  /**
   * @throws InvalidRequestException if {@code page} or {@code pageSize} is below 1
   */
  public JobPage page(Collection<JobSnapshot> jobs, int page, int pageSize) {
    if (page < 1) {
      throw new InvalidRequestException("page must be >= 1, got " + page);
    }
    if (pageSize < 1) {
      throw new InvalidRequestException("pageSize must be >= 1, got " + pageSize);
    }
    int effectivePageSize = Math.min(pageSize, maxPageSize);

    List<JobSnapshot> ordered = jobs.stream().sorted(CREATION_ORDER).toList();
    int totalJobs = ordered.size();
    int totalPages = (totalJobs + effectivePageSize - 1) / effectivePageSize;

    long start = (long) (page - 1) * effectivePageSize;
    List<JobSnapshot> items =
        start >= totalJobs
            ? List.of()
            : ordered.subList((int) start, (int) Math.min(start + effectivePageSize, totalJobs));

    return new JobPage(items, page, effectivePageSize, totalJobs, totalPages);
  }
}
