package com.scholary.djset.service;

import com.scholary.djset.config.JobProperties;
import com.scholary.djset.job.AppendOutcome;
import com.scholary.djset.job.InvalidRequestException;
import com.scholary.djset.job.JobOptions;
import com.scholary.djset.job.JobPage;
import com.scholary.djset.job.JobRegistry;
import com.scholary.djset.job.JobSnapshot;
import com.scholary.djset.job.JobStatus;
import com.scholary.djset.job.Paginator;
import com.scholary.djset.logging.StructuredLogger;
import com.scholary.djset.progress.ProgressBus;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.progress.ProgressSubscription;
import com.scholary.djset.tracklist.Tracklist;
import com.scholary.djset.tracklist.TracklistParser;
import com.scholary.djset.worker.AudioFormat;
import com.scholary.djset.worker.JobCancelledException;
import com.scholary.djset.worker.SplitWorker;
import com.scholary.djset.worker.WorkRequest;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives jobs through their lifecycle.
 *
 * <p>Submission validates the request, stores the job in the initializing state and queues a run
 * on the job executor. The run feeds every worker event through the registry, which checks it
 * against the state machine before it reaches the progress log. Worker faults, cancellation and
 * runs exceeding {@code jobs.runTimeout} are turned into terminal error events here; nothing
 * asynchronous is ever thrown to a caller.
 */
@Service
public class JobLifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobLifecycleManager.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String CANCELLED_ERROR = "cancelled";
  static final String CANCELLED_MESSAGE = "Job cancelled by user";
  static final String TIMED_OUT_MESSAGE = "Processing timed out";

  private final JobRegistry registry;
  private final ProgressBus progressBus;
  private final Paginator paginator;
  private final TracklistParser tracklistParser;
  private final SplitWorker worker;
  private final AsyncTaskExecutor jobExecutor;
  private final TaskScheduler timeoutScheduler;
  private final JobProperties properties;
  private final Map<String, JobRun> runs = new ConcurrentHashMap<>();

  public JobLifecycleManager(
      JobRegistry registry,
      ProgressBus progressBus,
      Paginator paginator,
      TracklistParser tracklistParser,
      SplitWorker worker,
      @Qualifier("jobExecutor") AsyncTaskExecutor jobExecutor,
      @Qualifier("jobTimeoutScheduler") TaskScheduler timeoutScheduler,
      JobProperties properties) {
    this.registry = registry;
    this.progressBus = progressBus;
    this.paginator = paginator;
    this.tracklistParser = tracklistParser;
    this.worker = worker;
    this.jobExecutor = jobExecutor;
    this.timeoutScheduler = timeoutScheduler;
    this.properties = properties;
  }

  /**
   * Create a job and queue it for processing.
   *
   * @return the new job's identifier; the job is in the initializing state
   * @throws InvalidRequestException if the url, tracklist or options are invalid
   */
  public String submit(String sourceUrl, String tracklistRaw, JobOptions options) {
    validateSourceUrl(sourceUrl);
    if (tracklistRaw == null || tracklistRaw.isBlank()) {
      throw new InvalidRequestException("tracklist is required");
    }
    JobOptions requested = options == null ? JobOptions.defaults() : options;
    AudioFormat format = resolveFormat(requested.fileExtension());
    int maxConcurrentTasks = resolveConcurrentTasks(requested.maxConcurrentTasks());
    Tracklist tracklist = tracklistParser.parse(tracklistRaw);

    String jobId =
        registry.create(
            sourceUrl, tracklistRaw, new JobOptions(format.extension(), maxConcurrentTasks));
    LOGGER.info(
        "Submitted job: jobId={}, tracks={}, format={}, maxConcurrentTasks={}",
        jobId,
        tracklist.size(),
        format.extension(),
        maxConcurrentTasks);

    JobRun run = new JobRun(jobId);
    runs.put(jobId, run);
    WorkRequest request =
        new WorkRequest(jobId, sourceUrl, tracklist, format.extension(), maxConcurrentTasks);
    try {
      run.attach(jobExecutor.submit(() -> execute(run, request)));
    } catch (TaskRejectedException e) {
      LOGGER.error("Job executor rejected job: jobId={}", jobId, e);
      runs.remove(jobId, run);
      run.complete();
      registry.appendIfActive(jobId, ProgressEvent.error("Failed to start job", e.getMessage()));
    }
    return jobId;
  }

  /**
   * Cancel a job.
   *
   * <p>A queued job is finalized at once. A running job is signalled and given up to the
   * configured cancel timeout to stop; after that its thread is interrupted and the job is
   * finalized anyway.
   *
   * @throws com.scholary.djset.job.JobNotFoundException if the job is unknown
   */
  public CancelOutcome cancel(String jobId) {
    if (registry.get(jobId).isTerminal()) {
      STRUCTURED_LOGGER.logCancellation(jobId, CancelOutcome.ALREADY_TERMINAL.name(), 0);
      return CancelOutcome.ALREADY_TERMINAL;
    }

    long started = System.nanoTime();
    JobRun run = runs.get(jobId);
    if (run != null) {
      run.token().cancel();
      if (run.claim()) {
        LOGGER.info("Cancelled job before it started: jobId={}", jobId);
        runs.remove(jobId, run);
        run.complete();
      } else {
        awaitStop(run);
      }
    }
    finishCancelled(jobId);

    CancelOutcome outcome =
        CANCELLED_ERROR.equals(registry.get(jobId).error())
            ? CancelOutcome.ACCEPTED
            : CancelOutcome.ALREADY_TERMINAL;
    STRUCTURED_LOGGER.logCancellation(
        jobId, outcome.name(), (System.nanoTime() - started) / 1_000_000);
    return outcome;
  }

  /**
   * @throws com.scholary.djset.job.JobNotFoundException if the job is unknown
   */
  public JobSnapshot get(String jobId) {
    return registry.get(jobId);
  }

  public JobPage list(int page, int pageSize) {
    return paginator.page(registry.list(), page, pageSize);
  }

  /**
   * @throws com.scholary.djset.job.JobNotFoundException if the job is unknown
   */
  public List<ProgressEvent> history(String jobId) {
    return registry.get(jobId).events();
  }

  /**
   * Subscribe to a job's live events. A subscription to a finished job delivers its terminal event
   * and ends.
   *
   * @throws com.scholary.djset.job.JobNotFoundException if the job is unknown
   */
  public ProgressSubscription subscribe(String jobId) {
    registry.get(jobId);
    return progressBus.subscribe(jobId);
  }

  @PreDestroy
  public void shutdown() {
    if (runs.isEmpty()) {
      return;
    }
    LOGGER.info("Shutting down: cancelling {} active jobs", runs.size());
    for (JobRun run : runs.values()) {
      run.token().cancel();
      if (!run.claim()) {
        run.interrupt();
      }
      finishCancelled(run.jobId());
    }
    runs.clear();
  }

  private void execute(JobRun run, WorkRequest request) {
    if (!run.claim()) {
      return;
    }
    String jobId = run.jobId();
    StructuredLogger.setJobContext(jobId, request.sourceUrl());
    ScheduledFuture<?> deadline = null;
    try {
      deadline =
          timeoutScheduler.schedule(
              () -> timeOut(run), Instant.now().plus(properties.runTimeout()));
      onWorkerEvent(
          run,
          request.tracklist(),
          ProgressEvent.of(ProgressStage.DOWNLOADING, 0.0, "Starting download"));
      worker.process(
          request, event -> onWorkerEvent(run, request.tracklist(), event), run.token());

      if (!run.token().isCancelled() && !registry.get(jobId).isTerminal()) {
        LOGGER.error("Worker returned without a terminal event: jobId={}", jobId);
        registry.appendIfActive(
            jobId,
            ProgressEvent.error(
                "Processing failed", "Worker finished without reporting completion"));
      }
    } catch (JobCancelledException e) {
      LOGGER.info("Worker stopped after cancellation: jobId={}", jobId);
    } catch (RuntimeException e) {
      if (run.token().isCancelled()) {
        LOGGER.info("Worker failed after cancellation: jobId={}, cause={}", jobId, e.getMessage());
      } else {
        LOGGER.error("Worker failed: jobId={}", jobId, e);
        registry.appendIfActive(jobId, ProgressEvent.error("Processing failed", describe(e)));
      }
    } finally {
      if (deadline != null) {
        deadline.cancel(false);
      }
      if (run.isTimedOut()) {
        finishTimedOut(jobId);
      } else if (run.token().isCancelled()) {
        finishCancelled(jobId);
      }
      runs.remove(jobId, run);
      run.complete();
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Route one worker event into the registry. Once cancellation was requested, terminal events
   * from the worker are dropped and late progress is no longer reported as a violation.
   */
  private void onWorkerEvent(JobRun run, Tracklist tracklist, ProgressEvent event) {
    String jobId = run.jobId();
    if (run.token().isCancelled()) {
      if (event.isTerminal()) {
        LOGGER.debug("Dropped worker terminal event after cancellation: jobId={}", jobId);
      } else {
        registry.appendIfActive(jobId, event);
      }
      return;
    }

    AppendOutcome outcome;
    if (event.stage() == ProgressStage.IMPORTING) {
      outcome = registry.appendEvent(jobId, event, job -> job.attachTracklist(tracklist));
    } else {
      outcome = registry.appendEvent(jobId, event);
    }

    if (!outcome.applied()) {
      STRUCTURED_LOGGER.logProtocolViolation(jobId, event.stage().wireName(), outcome.violation());
      return;
    }

    JobStatus status = JobStatus.of(event.stage());
    if (status != run.lastStatus()) {
      STRUCTURED_LOGGER.logJobTransition(
          jobId, run.lastStatus().wireName(), status.wireName(), event.message());
      run.lastStatus(status);
    }
    if (event.trackDetails() != null) {
      STRUCTURED_LOGGER.logJobProgress(
          jobId,
          event.stage().wireName(),
          event.progress() == null ? 0.0 : event.progress(),
          event.trackDetails().processedTracks(),
          event.trackDetails().totalTracks());
    }
  }

  private void awaitStop(JobRun run) {
    try {
      if (!run.awaitCompletion(properties.cancelTimeout())) {
        LOGGER.warn(
            "Job did not stop within {}, interrupting: jobId={}",
            properties.cancelTimeout(),
            run.jobId());
        run.interrupt();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for job to stop: jobId={}", run.jobId());
    }
  }

  /**
   * Stop a run that exceeded the run timeout. The worker is signalled like a cancel; if it has not
   * stopped after the cancel timeout, its thread is interrupted.
   */
  private void timeOut(JobRun run) {
    if (run.token().isCancelled() || !run.markTimedOut()) {
      return;
    }
    LOGGER.warn(
        "Job exceeded run timeout of {}, stopping: jobId={}", properties.runTimeout(), run.jobId());
    run.token().cancel();
    timeoutScheduler.schedule(run::interrupt, Instant.now().plus(properties.cancelTimeout()));
  }

  private void finishTimedOut(String jobId) {
    String error = "run exceeded " + properties.runTimeout();
    if (registry.appendIfActive(jobId, ProgressEvent.error(TIMED_OUT_MESSAGE, error))) {
      LOGGER.info("Job timed out: jobId={}", jobId);
    }
  }

  private void finishCancelled(String jobId) {
    if (registry.appendIfActive(jobId, ProgressEvent.error(CANCELLED_MESSAGE, CANCELLED_ERROR))) {
      LOGGER.info("Job cancelled: jobId={}", jobId);
    }
  }

  private void validateSourceUrl(String sourceUrl) {
    if (sourceUrl == null || sourceUrl.isBlank()) {
      throw new InvalidRequestException("url is required");
    }
    try {
      URI uri = new URI(sourceUrl.trim());
      String scheme = uri.getScheme();
      if (scheme == null
          || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
          || uri.getHost() == null) {
        throw new InvalidRequestException("url must be an http or https URL: " + sourceUrl);
      }
    } catch (URISyntaxException e) {
      throw new InvalidRequestException("url is malformed: " + sourceUrl);
    }
  }

  private AudioFormat resolveFormat(String fileExtension) {
    String extension =
        fileExtension == null || fileExtension.isBlank()
            ? properties.defaultFileExtension()
            : fileExtension;
    return AudioFormat.fromExtension(extension)
        .orElseThrow(
            () -> new InvalidRequestException("unsupported file extension: " + fileExtension));
  }

  private int resolveConcurrentTasks(Integer requested) {
    if (requested == null || requested <= 0) {
      return properties.defaultMaxConcurrentTasks();
    }
    return Math.min(requested, properties.maxAllowedConcurrentTasks());
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
