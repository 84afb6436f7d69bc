package com.scholary.djset.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.djset.config.JobProperties;
import com.scholary.djset.config.ProgressProperties;
import com.scholary.djset.job.InvalidRequestException;
import com.scholary.djset.job.JobNotFoundException;
import com.scholary.djset.job.JobOptions;
import com.scholary.djset.job.JobPage;
import com.scholary.djset.job.JobRegistry;
import com.scholary.djset.job.JobSnapshot;
import com.scholary.djset.job.JobStatus;
import com.scholary.djset.job.Paginator;
import com.scholary.djset.progress.ProgressBus;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.progress.ProgressSubscription;
import com.scholary.djset.progress.TrackDetails;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.TracklistParser;
import com.scholary.djset.worker.SplitWorker;
import com.scholary.djset.worker.WorkerException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class JobLifecycleManagerTest {

  private static final String URL = "https://example.com/set.mp3";
  private static final String TRACKLIST = "1. A - X 00:00-03:30\n2. B - Y 03:30-07:00";
  private static final Duration CANCEL_TIMEOUT = Duration.ofMillis(300);

  private JobProperties properties;
  private ProgressBus progressBus;
  private JobRegistry registry;
  private ExecutorService threads;
  private ThreadPoolTaskScheduler timeoutScheduler;
  private final List<Runnable> queued = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    properties = properties(Duration.ofMinutes(1));
    progressBus = new ProgressBus(new ProgressProperties(256, Duration.ofMinutes(1)));
    registry = new JobRegistry(progressBus, properties);
    threads = Executors.newCachedThreadPool();
    timeoutScheduler = new ThreadPoolTaskScheduler();
    timeoutScheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    threads.shutdownNow();
    timeoutScheduler.shutdown();
  }

  @Test
  void submit_shouldReturnJobInInitializingState() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());

    String jobId = manager.submit(URL, TRACKLIST, null);

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.INITIALIZING);
    assertThat(job.progress()).isZero();
    assertThat(job.options().fileExtension()).isEqualTo("mp3");
    assertThat(job.options().maxConcurrentTasks()).isEqualTo(4);
    assertThat(queued).hasSize(1);
  }

  @Test
  void submit_shouldNormalizeOptions() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());

    String capped = manager.submit(URL, TRACKLIST, new JobOptions(".FLAC", 50));
    String defaulted = manager.submit(URL, TRACKLIST, new JobOptions("", 0));

    assertThat(manager.get(capped).options()).isEqualTo(new JobOptions("flac", 10));
    assertThat(manager.get(defaulted).options()).isEqualTo(new JobOptions("mp3", 4));
  }

  @Test
  void submit_shouldRejectInvalidRequests() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());

    assertThatThrownBy(() -> manager.submit(" ", TRACKLIST, null))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("url");
    assertThatThrownBy(() -> manager.submit("ftp://example.com/set.mp3", TRACKLIST, null))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> manager.submit(URL, "", null))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("tracklist");
    assertThatThrownBy(() -> manager.submit(URL, "not a tracklist", null))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("invalid tracklist");
    assertThatThrownBy(() -> manager.submit(URL, TRACKLIST, new JobOptions("ogg", null)))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("unsupported file extension");

    assertThat(registry.list()).isEmpty();
    assertThat(queued).isEmpty();
  }

  @Test
  void successfulRun_shouldCompleteWithAllResults() throws Exception {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    ProgressSubscription subscription = manager.subscribe(jobId);

    runQueued();

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETE);
    assertThat(job.progress()).isEqualTo(1.0);
    assertThat(job.startTime()).isNotNull();
    assertThat(job.endTime()).isNotNull();
    assertThat(job.error()).isNull();
    assertThat(job.results()).containsExactly("out/1.mp3", "out/2.mp3");
    assertThat(job.tracklist().tracks()).extracting(Track::name).containsExactly("X", "Y");
    assertThat(job.rejectedEvents()).isEmpty();

    List<ProgressEvent> history = manager.history(jobId);
    assertThat(history.get(0).message()).isEqualTo("Starting download");
    assertThat(history).extracting(ProgressEvent::stage).isSorted();
    assertThat(history.get(history.size() - 1).stage()).isEqualTo(ProgressStage.COMPLETE);

    List<ProgressEvent> streamed = new ArrayList<>();
    Optional<ProgressEvent> next;
    while ((next = subscription.poll(Duration.ofMillis(50))).isPresent()) {
      streamed.add(next.get());
    }
    assertThat(streamed).isEqualTo(history);
  }

  @Test
  void eventAfterTerminal_shouldBeRejectedAndKeepJobComplete() {
    SplitWorker worker =
        (request, sink, token) -> {
          sink.emit(ProgressEvent.of(ProgressStage.IMPORTING, 0.25, "Importing"));
          sink.emit(ProgressEvent.of(ProgressStage.PROCESSING, 0.25, "Processing"));
          sink.emit(ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Done"));
          sink.emit(ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "Late"));
        };
    JobLifecycleManager manager = manager(worker, manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    runQueued();

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.COMPLETE);
    assertThat(job.events()).extracting(ProgressEvent::message).doesNotContain("Late");
    assertThat(job.rejectedEvents()).hasSize(1);
    assertThat(job.rejectedEvents().get(0).reason()).contains("already complete");
  }

  @Test
  void workerSkippingStages_shouldEndAsFault() {
    SplitWorker worker =
        (request, sink, token) -> sink.emit(ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Done"));
    JobLifecycleManager manager = manager(worker, manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    runQueued();

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.error()).isEqualTo("Worker finished without reporting completion");
    assertThat(job.rejectedEvents()).hasSize(1);
  }

  @Test
  void workerFault_shouldBecomeTerminalError() {
    SplitWorker worker =
        (request, sink, token) -> {
          sink.emit(ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "Downloading"));
          throw new WorkerException("Download failed: example.com answered with HTTP 404");
        };
    JobLifecycleManager manager = manager(worker, manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    runQueued();

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.message()).isEqualTo("Processing failed");
    assertThat(job.error()).contains("HTTP 404");
    assertThat(job.endTime()).isNotNull();
  }

  @Test
  void cancel_beforeStart_shouldFinalizeImmediately() {
    AtomicBoolean invoked = new AtomicBoolean();
    JobLifecycleManager manager =
        manager((request, sink, token) -> invoked.set(true), manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    assertThat(manager.cancel(jobId)).isEqualTo(CancelOutcome.ACCEPTED);
    runQueued();

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.error()).isEqualTo("cancelled");
    assertThat(job.message()).isEqualTo("Job cancelled by user");
    assertThat(invoked).isFalse();
  }

  @Test
  void cancel_runningJob_shouldStopWorker() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    SplitWorker worker =
        (request, sink, token) -> {
          started.countDown();
          while (true) {
            token.throwIfCancelled();
            sink.emit(ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "Downloading"));
            pause(5);
          }
        };
    JobLifecycleManager manager = manager(worker, threadExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    CancelOutcome outcome = manager.cancel(jobId);

    JobSnapshot job = manager.get(jobId);
    assertThat(outcome).isEqualTo(CancelOutcome.ACCEPTED);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.error()).isEqualTo("cancelled");
    assertThat(job.events().get(job.events().size() - 1).error()).isEqualTo("cancelled");
    assertThat(manager.cancel(jobId)).isEqualTo(CancelOutcome.ALREADY_TERMINAL);
  }

  @Test
  void cancel_hungWorker_shouldReturnWithinTimeout() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    SplitWorker worker =
        (request, sink, token) -> {
          started.countDown();
          try {
            new CountDownLatch(1).await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("interrupted", e);
          }
        };
    JobLifecycleManager manager = manager(worker, threadExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    long begin = System.nanoTime();
    CancelOutcome outcome = manager.cancel(jobId);
    Duration waited = Duration.ofNanos(System.nanoTime() - begin);

    assertThat(outcome).isEqualTo(CancelOutcome.ACCEPTED);
    assertThat(waited).isLessThan(CANCEL_TIMEOUT.plusSeconds(2));
    assertThat(manager.get(jobId).error()).isEqualTo("cancelled");
  }

  @Test
  void cancel_shouldSupersedeWorkerCompletion() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    SplitWorker worker =
        (request, sink, token) -> {
          started.countDown();
          while (!token.isCancelled()) {
            pause(5);
          }
          sink.emit(ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Done anyway"));
        };
    JobLifecycleManager manager = manager(worker, threadExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(manager.cancel(jobId)).isEqualTo(CancelOutcome.ACCEPTED);

    JobSnapshot job = manager.get(jobId);
    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.error()).isEqualTo("cancelled");
    assertThat(job.events()).extracting(ProgressEvent::message).doesNotContain("Done anyway");
  }

  @Test
  void runExceedingTimeout_shouldStopWorkerAndEndInError() throws Exception {
    properties = properties(Duration.ofMillis(200));
    CountDownLatch stopped = new CountDownLatch(1);
    SplitWorker worker =
        (request, sink, token) -> {
          sink.emit(ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "Downloading"));
          try {
            while (true) {
              token.throwIfCancelled();
              pause(5);
            }
          } finally {
            stopped.countDown();
          }
        };
    JobLifecycleManager manager = manager(worker, threadExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
    JobSnapshot job = awaitTerminal(manager, jobId);

    assertThat(job.status()).isEqualTo(JobStatus.ERROR);
    assertThat(job.message()).isEqualTo("Processing timed out");
    assertThat(job.error()).contains("run exceeded");
    assertThat(manager.cancel(jobId)).isEqualTo(CancelOutcome.ALREADY_TERMINAL);
  }

  @Test
  void runFinishingInTime_shouldNotBeTimedOut() throws Exception {
    properties = properties(Duration.ofMillis(200));
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);

    runQueued();
    Thread.sleep(400);

    assertThat(manager.get(jobId).status()).isEqualTo(JobStatus.COMPLETE);
  }

  @Test
  void cancel_completedJob_shouldLeaveItUntouched() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    runQueued();

    assertThat(manager.cancel(jobId)).isEqualTo(CancelOutcome.ALREADY_TERMINAL);
    assertThat(manager.get(jobId).status()).isEqualTo(JobStatus.COMPLETE);
  }

  @Test
  void unknownJob_shouldThrowNotFound() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());

    assertThatThrownBy(() -> manager.cancel("missing")).isInstanceOf(JobNotFoundException.class);
    assertThatThrownBy(() -> manager.get("missing")).isInstanceOf(JobNotFoundException.class);
    assertThatThrownBy(() -> manager.history("missing")).isInstanceOf(JobNotFoundException.class);
    assertThatThrownBy(() -> manager.subscribe("missing"))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void list_shouldPageInSubmissionOrder() {
    JobLifecycleManager manager = manager(succeedingWorker(), manualExecutor());
    String first = manager.submit(URL, TRACKLIST, null);
    String second = manager.submit(URL, TRACKLIST, null);
    manager.submit(URL, TRACKLIST, null);

    JobPage page = manager.list(1, 2);

    assertThat(page.items()).extracting(JobSnapshot::id).containsExactly(first, second);
    assertThat(page.totalJobs()).isEqualTo(3);
    assertThat(page.totalPages()).isEqualTo(2);
  }

  @Test
  void shutdown_shouldCancelActiveJobs() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    SplitWorker worker =
        (request, sink, token) -> {
          started.countDown();
          while (true) {
            token.throwIfCancelled();
            pause(5);
          }
        };
    JobLifecycleManager manager = manager(worker, threadExecutor());
    String jobId = manager.submit(URL, TRACKLIST, null);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    manager.shutdown();

    assertThat(manager.get(jobId).error()).isEqualTo("cancelled");
  }

  private JobLifecycleManager manager(SplitWorker worker, AsyncTaskExecutor executor) {
    return new JobLifecycleManager(
        registry,
        progressBus,
        new Paginator(properties),
        new TracklistParser(new ObjectMapper(), properties),
        worker,
        executor,
        timeoutScheduler,
        properties);
  }

  private static JobProperties properties(Duration runTimeout) {
    return new JobProperties(
        4, 4, 10, 100, 100, CANCEL_TIMEOUT, runTimeout, Duration.ofHours(24), "mp3");
  }

  private static JobSnapshot awaitTerminal(JobLifecycleManager manager, String jobId)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    JobSnapshot job = manager.get(jobId);
    while (!job.isTerminal() && System.nanoTime() < deadline) {
      Thread.sleep(10);
      job = manager.get(jobId);
    }
    return job;
  }

  /** Queues runs until {@link #runQueued()} executes them on the test thread. */
  private AsyncTaskExecutor manualExecutor() {
    return new ConcurrentTaskExecutor(queued::add);
  }

  private AsyncTaskExecutor threadExecutor() {
    return new ConcurrentTaskExecutor(threads);
  }

  private void runQueued() {
    List<Runnable> tasks = new ArrayList<>(queued);
    queued.clear();
    tasks.forEach(Runnable::run);
  }

  private static SplitWorker succeedingWorker() {
    return (request, sink, token) -> {
      sink.emit(ProgressEvent.of(ProgressStage.DOWNLOADING, 0.2, "Downloading"));
      sink.emit(ProgressEvent.of(ProgressStage.IMPORTING, 0.25, "Importing tracklist"));
      sink.emit(ProgressEvent.of(ProgressStage.PROCESSING, 0.25, "Tracklist parsed: 2 tracks"));
      int total = request.tracklist().size();
      for (Track track : request.tracklist().tracks()) {
        int n = track.trackNumber();
        sink.emit(
            ProgressEvent.trackCompleted(
                0.25 + 0.74 * n / total,
                "Processed track " + n + "/" + total,
                new TrackDetails(track.name(), n, n, total),
                "out/" + n + ".mp3"));
      }
      sink.emit(ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Processing completed"));
    };
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WorkerException("interrupted", e);
    }
  }
}
