package com.scholary.djset.api;

import com.scholary.djset.job.JobOptions;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.service.CancelOutcome;
import com.scholary.djset.service.JobLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for DJ set processing jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a set for download and splitting (returns a job ID immediately)
 *   <li>Listing jobs and polling a single job
 *   <li>Cancelling a job
 *   <li>Reading or streaming a job's progress events
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Jobs", description = "DJ set download and split jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobLifecycleManager manager;
  private final ProgressStreamer streamer;

  public JobController(JobLifecycleManager manager, ProgressStreamer streamer) {
    this.manager = manager;
    this.streamer = streamer;
  }

  @PostMapping("/process")
  @Operation(
      summary = "Start processing",
      description = "Queue a DJ set for download and splitting; returns the job ID to poll")
  public ResponseEntity<ProcessResponse> process(@Valid @RequestBody ProcessRequest request) {
    LOGGER.info("Process request: url={}", request.url());
    String jobId =
        manager.submit(
            request.url(),
            request.tracklist(),
            new JobOptions(request.fileExtension(), request.maxConcurrentTasks()));
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new ProcessResponse("Processing started", jobId));
  }

  @GetMapping("/jobs")
  @Operation(summary = "List jobs", description = "Jobs in submission order, one page at a time")
  public JobListResponse listJobs(
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "10") int pageSize) {
    return JobListResponse.from(manager.list(page, pageSize));
  }

  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job", description = "Current state of a job with its event history")
  public JobResponse getJob(@PathVariable String id) {
    return JobResponse.detail(manager.get(id));
  }

  /**
   * Cancel a job. Blocks until the job has stopped or the cancel timeout elapsed; the job is
   * terminal either way when this returns.
   */
  @PostMapping("/jobs/{id}/cancel")
  @Operation(summary = "Cancel job", description = "Stop a queued or running job")
  public ResponseEntity<MessageResponse> cancelJob(@PathVariable String id) {
    CancelOutcome outcome = manager.cancel(id);
    if (outcome == CancelOutcome.ALREADY_TERMINAL) {
      return ResponseEntity.status(HttpStatus.CONFLICT)
          .body(new MessageResponse("Job already finished"));
    }
    return ResponseEntity.ok(new MessageResponse("Job cancelled"));
  }

  @GetMapping("/jobs/{id}/events")
  @Operation(summary = "Get job events", description = "Full ordered progress history of a job")
  public List<ProgressEvent> getEvents(@PathVariable String id) {
    return manager.history(id);
  }

  @GetMapping("/jobs/{id}/stream")
  @Operation(
      summary = "Stream job progress",
      description = "Server-sent events from now until the job finishes; event name is the stage")
  public SseEmitter streamProgress(@PathVariable String id) {
    return streamer.stream(manager.subscribe(id));
  }
}
