package com.scholary.djset.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.djset.config.JobProperties;
import com.scholary.djset.progress.ProgressBus;
import com.scholary.djset.progress.ProgressEvent;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of all jobs.
 *
 * <p>Backed by a Caffeine cache with a per-entry expiry: jobs never expire while they are running,
 * and are evicted a configurable retention period after they reach a terminal state. Eviction also
 * releases the job's progress log.
 *
 * <p>Every mutation of a job runs under that job's own lock, so updates to one job are serialized
 * while different jobs never contend.
 */
@Repository
public class JobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  private final Cache<String, Job> cache;
  private final ProgressBus progressBus;
  private final Clock clock;
  private final Duration retention;
  private final AtomicLong sequence = new AtomicLong();

  @Autowired
  public JobRegistry(ProgressBus progressBus, JobProperties properties) {
    this(progressBus, properties.retention(), Ticker.systemTicker(), Clock.systemUTC());
  }

  JobRegistry(ProgressBus progressBus, Duration retention, Ticker ticker, Clock clock) {
    this.progressBus = progressBus;
    this.clock = clock;
    this.retention = retention;
    this.cache =
        Caffeine.newBuilder()
            .expireAfter(new TerminalJobExpiry(retention))
            .ticker(ticker)
            .executor(Runnable::run)
            .removalListener(
                (String jobId, Job job, RemovalCause cause) -> {
                  if (cause != RemovalCause.REPLACED) {
                    progressBus.release(jobId);
                    LOGGER.info("Removed job: jobId={}, cause={}", jobId, cause);
                  }
                })
            .build();

    LOGGER.info("Initialized job registry: retention={}", retention);
  }

  /**
   * Store a new job in the initializing state.
   *
   * @return the new job's identifier
   */
  public String create(String sourceUrl, String tracklistRaw, JobOptions options) {
    while (true) {
      String jobId = UUID.randomUUID().toString();
      Job job =
          new Job(jobId, sequence.incrementAndGet(), sourceUrl, tracklistRaw, options, clock.instant());
      if (cache.asMap().putIfAbsent(jobId, job) == null) {
        LOGGER.debug("Created job: jobId={}, sequence={}", jobId, job.getSequence());
        return jobId;
      }
    }
  }

  public Optional<JobSnapshot> find(String jobId) {
    Job job = cache.getIfPresent(jobId);
    return job == null ? Optional.empty() : Optional.of(snapshot(job));
  }

  /**
   * @throws JobNotFoundException if the job is unknown
   */
  public JobSnapshot get(String jobId) {
    return snapshot(require(jobId));
  }

  /**
   * Apply an atomic in-place mutation to one job.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public void update(String jobId, Consumer<Job> mutator) {
    Job job = require(jobId);
    boolean becameTerminal;
    job.lock().lock();
    try {
      boolean wasTerminal = job.isTerminal();
      mutator.accept(job);
      becameTerminal = !wasTerminal && job.isTerminal();
    } finally {
      job.lock().unlock();
    }
    if (becameTerminal) {
      startRetention(jobId);
    }
  }

  /** All jobs, unordered. */
  public List<JobSnapshot> list() {
    return list(job -> true);
  }

  public List<JobSnapshot> list(Predicate<JobSnapshot> filter) {
    List<JobSnapshot> jobs = new ArrayList<>();
    for (Job job : cache.asMap().values()) {
      JobSnapshot snapshot = snapshot(job);
      if (filter.test(snapshot)) {
        jobs.add(snapshot);
      }
    }
    return jobs;
  }

  /** Same as {@link #appendEvent(String, ProgressEvent, Consumer)} without a follow-up mutation. */
  public AppendOutcome appendEvent(String jobId, ProgressEvent event) {
    return appendEvent(jobId, event, null);
  }

  /**
   * Offer a progress event to a job.
   *
   * <p>Under the job's lock: the event is checked against the state machine; a violating event is
   * recorded on the job as rejected and nothing else changes. An accepted event is appended to the
   * progress log, applied to the job's projection, and then {@code onApplied} (if given) runs.
   * Timestamps that go backwards are clamped to the previous event's timestamp.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public AppendOutcome appendEvent(String jobId, ProgressEvent event, Consumer<Job> onApplied) {
    return offer(jobId, event, onApplied, true);
  }

  /**
   * Append an event only if the job is still active. Used for terminal events the service itself
   * produces, where losing a race against another terminal event is expected and not a violation.
   *
   * @return true if the event was applied
   */
  public boolean appendIfActive(String jobId, ProgressEvent event) {
    return offer(jobId, event, null, false).applied();
  }

  private AppendOutcome offer(
      String jobId, ProgressEvent event, Consumer<Job> onApplied, boolean recordRejection) {
    Job job = require(jobId);
    AppendOutcome outcome;
    boolean becameTerminal = false;

    job.lock().lock();
    try {
      ProgressEvent stamped = clampTimestamp(job, event);
      Optional<String> violation = JobTransitions.check(job, stamped);
      if (violation.isPresent()) {
        if (recordRejection) {
          job.recordRejected(new RejectedEvent(stamped, violation.get()));
        }
        outcome = AppendOutcome.rejected(violation.get());
      } else {
        progressBus.append(jobId, stamped);
        job.apply(stamped);
        if (onApplied != null) {
          onApplied.accept(job);
        }
        becameTerminal = job.isTerminal();
        outcome = AppendOutcome.success();
      }
    } finally {
      job.lock().unlock();
    }

    if (becameTerminal) {
      startRetention(jobId);
    }
    return outcome;
  }

  private ProgressEvent clampTimestamp(Job job, ProgressEvent event) {
    if (job.getLastEventTime() != null && event.timestamp().isBefore(job.getLastEventTime())) {
      return event.withTimestamp(job.getLastEventTime());
    }
    return event;
  }

  /** Start the retention clock of a job that just became terminal. */
  private void startRetention(String jobId) {
    cache.policy().expireVariably().ifPresent(policy -> policy.setExpiresAfter(jobId, retention));
  }

  /** Force pending expirations; mainly useful with a manual ticker. */
  void cleanUp() {
    cache.cleanUp();
  }

  private Job require(String jobId) {
    Job job = cache.getIfPresent(jobId);
    if (job == null) {
      throw new JobNotFoundException(jobId);
    }
    return job;
  }

  private JobSnapshot snapshot(Job job) {
    job.lock().lock();
    try {
      return job.snapshot(progressBus.history(job.getId()));
    } finally {
      job.lock().unlock();
    }
  }

  /** Running jobs never expire; terminal jobs expire {@code retention} after they finish. */
  private static final class TerminalJobExpiry implements Expiry<String, Job> {

    private final long retentionNanos;

    TerminalJobExpiry(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String jobId, Job job, long currentTime) {
      return Long.MAX_VALUE;
    }

    @Override
    public long expireAfterUpdate(
        String jobId, Job job, long currentTime, long currentDuration) {
      return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
    }

    @Override
    public long expireAfterRead(
        String jobId, Job job, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
