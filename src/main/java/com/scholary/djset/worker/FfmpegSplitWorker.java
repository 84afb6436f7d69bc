package com.scholary.djset.worker;

import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.progress.TrackDetails;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Default worker: downloads the set over HTTP and cuts it into tracks with ffmpeg.
 *
 * <p>Progress fractions are spread over the whole job: the download covers [0.00, 0.25], cutting
 * covers [0.25, 0.99] in equal steps per finished track, and completion reports 1.0.
 *
 * <p>Tracks are cut in parallel, up to the request's {@code maxConcurrentTasks}. Per-track events
 * are emitted from the calling thread in completion order, so the sink sees one event at a time.
 * The caller's MDC job context is carried into the split threads.
 */
@Component
public class FfmpegSplitWorker implements SplitWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSplitWorker.class);

  static final double DOWNLOAD_END = 0.25;
  static final double PROCESSING_END = 0.99;

  private final HttpSourceDownloader downloader;
  private final FfmpegTrackSplitter splitter;
  private final WorkerProperties properties;

  public FfmpegSplitWorker(
      HttpSourceDownloader downloader, FfmpegTrackSplitter splitter, WorkerProperties properties) {
    this.downloader = downloader;
    this.splitter = splitter;
    this.properties = properties;
  }

  @Override
  public void process(WorkRequest request, ProgressSink sink, CancellationToken token) {
    AudioFormat format =
        AudioFormat.fromExtension(request.fileExtension())
            .orElseThrow(
                () -> new WorkerException("Unsupported file extension: " + request.fileExtension()));
    Path workDir = Paths.get(properties.workDir(), request.jobId());
    Path outputDir = Paths.get(properties.outputDir(), request.jobId());

    try {
      token.throwIfCancelled();
      Path source =
          downloader.download(
              request.sourceUrl(),
              workDir,
              fraction ->
                  sink.emit(
                      ProgressEvent.of(
                          ProgressStage.DOWNLOADING,
                          DOWNLOAD_END * fraction,
                          String.format("Downloading: %d%%", Math.round(fraction * 100)))),
              token);

      token.throwIfCancelled();
      sink.emit(ProgressEvent.of(ProgressStage.IMPORTING, DOWNLOAD_END, "Importing tracklist"));

      Tracklist tracklist = request.tracklist();
      sink.emit(
          ProgressEvent.of(
              ProgressStage.PROCESSING,
              DOWNLOAD_END,
              String.format("Tracklist parsed: %d tracks", tracklist.size())));

      splitAll(request, source, tracklist, format, outputDir, sink, token);

      sink.emit(ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Processing completed"));
    } finally {
      deleteRecursively(workDir);
    }
  }

  private void splitAll(
      WorkRequest request,
      Path source,
      Tracklist tracklist,
      AudioFormat format,
      Path outputDir,
      ProgressSink sink,
      CancellationToken token) {

    int total = tracklist.size();
    int parallelism = Math.max(1, Math.min(request.maxConcurrentTasks(), total));
    LOGGER.info("Splitting {} tracks with parallelism {}", total, parallelism);

    AtomicInteger threadCounter = new AtomicInteger();
    ExecutorService pool =
        Executors.newFixedThreadPool(
            parallelism,
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName("djset-split-" + threadCounter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
    CompletionService<SplitResult> completion = new ExecutorCompletionService<>(pool);

    try {
      Map<String, String> context = MDC.getCopyOfContextMap();
      for (Track track : tracklist.tracks()) {
        completion.submit(
            withContext(
                context,
                () ->
                    new SplitResult(
                        track,
                        splitter.split(source, tracklist, track, format, outputDir, token))));
      }

      for (int processed = 1; processed <= total; processed++) {
        SplitResult result = unwrap(completion.take());
        Track track = result.track();
        double progress = DOWNLOAD_END + (PROCESSING_END - DOWNLOAD_END) * processed / total;
        sink.emit(
            ProgressEvent.trackCompleted(
                progress,
                String.format("Processed track %d/%d: %s", processed, total, track.name()),
                new TrackDetails(track.name(), track.trackNumber(), processed, total),
                result.file().toString()));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WorkerException("Track splitting interrupted", e);
    } finally {
      pool.shutdownNow();
    }
  }

  private static <T> Callable<T> withContext(Map<String, String> context, Callable<T> task) {
    return () -> {
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        return task.call();
      } finally {
        MDC.clear();
      }
    };
  }

  private static SplitResult unwrap(Future<SplitResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new WorkerException("Track splitting failed: " + cause.getMessage(), cause);
    }
  }

  private void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}: {}", dir, e.getMessage());
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }

  private record SplitResult(Track track, Path file) {}
}
