package com.scholary.djset.service;

import com.scholary.djset.job.JobStatus;
import com.scholary.djset.worker.CancellationToken;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one execution of a job: its cancellation token, the executor's future and a completion
 * signal that fires when the execution has fully wound down.
 *
 * <p>Exactly one party claims the run: either the executor thread that starts it, or a cancel
 * request that arrives while it is still queued.
 */
final class JobRun {

  private final String jobId;
  private final CancellationToken token = new CancellationToken();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final AtomicBoolean claimed = new AtomicBoolean();
  private final AtomicBoolean timedOut = new AtomicBoolean();
  private volatile Future<?> future;
  private volatile JobStatus lastStatus = JobStatus.INITIALIZING;

  JobRun(String jobId) {
    this.jobId = jobId;
  }

  String jobId() {
    return jobId;
  }

  CancellationToken token() {
    return token;
  }

  /** @return true for the first caller only */
  boolean claim() {
    return claimed.compareAndSet(false, true);
  }

  /** @return true for the first caller only; the run is then stopping because it ran too long */
  boolean markTimedOut() {
    return timedOut.compareAndSet(false, true);
  }

  boolean isTimedOut() {
    return timedOut.get();
  }

  void attach(Future<?> submitted) {
    this.future = submitted;
  }

  /** Interrupt the executing thread, if any. */
  void interrupt() {
    Future<?> submitted = future;
    if (submitted != null) {
      submitted.cancel(true);
    }
  }

  void complete() {
    completion.complete(null);
  }

  /**
   * Wait for the run to wind down.
   *
   * @return false if the timeout elapsed first
   */
  boolean awaitCompletion(Duration timeout) throws InterruptedException {
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Run completion failed for job " + jobId, e.getCause());
    }
  }

  JobStatus lastStatus() {
    return lastStatus;
  }

  void lastStatus(JobStatus status) {
    this.lastStatus = status;
  }
}
