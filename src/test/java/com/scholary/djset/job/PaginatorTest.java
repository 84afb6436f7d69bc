package com.scholary.djset.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.djset.config.JobProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PaginatorTest {

  private Paginator paginator;
  private List<JobSnapshot> jobs;

  @BeforeEach
  void setUp() {
    paginator =
        new Paginator(
            new JobProperties(
                4,
                4,
                10,
                3,
                100,
                Duration.ofSeconds(10),
                Duration.ofMinutes(45),
                Duration.ofHours(24),
                "mp3"));
    jobs = new ArrayList<>();
    // Inserted out of order on purpose.
    for (long sequence : new long[] {3, 1, 5, 2, 4}) {
      jobs.add(snapshot("job-" + sequence, sequence));
    }
  }

  @Test
  void page_shouldSplitInCreationOrder() {
    JobPage first = paginator.page(jobs, 1, 2);
    JobPage last = paginator.page(jobs, 3, 2);

    assertThat(first.items()).extracting(JobSnapshot::id).containsExactly("job-1", "job-2");
    assertThat(first.totalJobs()).isEqualTo(5);
    assertThat(first.totalPages()).isEqualTo(3);
    assertThat(last.items()).extracting(JobSnapshot::id).containsExactly("job-5");
  }

  @Test
  void page_pastTheEnd_shouldBeEmptyWithAccurateTotals() {
    JobPage page = paginator.page(jobs, 4, 2);

    assertThat(page.items()).isEmpty();
    assertThat(page.totalJobs()).isEqualTo(5);
    assertThat(page.totalPages()).isEqualTo(3);
  }

  @Test
  void page_shouldClampPageSize() {
    JobPage page = paginator.page(jobs, 1, 50);

    assertThat(page.pageSize()).isEqualTo(3);
    assertThat(page.items()).hasSize(3);
    assertThat(page.totalPages()).isEqualTo(2);
  }

  @Test
  void page_shouldRejectInvalidArguments() {
    assertThatThrownBy(() -> paginator.page(jobs, 0, 2))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("page");
    assertThatThrownBy(() -> paginator.page(jobs, 1, 0))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("pageSize");
  }

  @Test
  void page_shouldHandleNoJobs() {
    JobPage page = paginator.page(List.of(), 1, 10);

    assertThat(page.items()).isEmpty();
    assertThat(page.totalJobs()).isZero();
    assertThat(page.totalPages()).isZero();
  }

  private static JobSnapshot snapshot(String id, long sequence) {
    return new JobSnapshot(
        id,
        sequence,
        "https://example.com/set.mp3",
        "A - X 0:00",
        JobOptions.defaults(),
        JobStatus.INITIALIZING,
        Instant.now(),
        null,
        null,
        0.0,
        "Job created",
        null,
        null,
        List.of(),
        List.of(),
        List.of());
  }
}
