package com.scholary.djset.service;

import com.scholary.djset.job.JobNotCompleteException;
import com.scholary.djset.job.JobSnapshot;
import com.scholary.djset.job.JobStatus;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import com.scholary.djset.worker.FfmpegTrackSplitter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read access to the files produced by completed jobs.
 *
 * <p>Files are matched to tracks through the per-track completion events, since tracks are cut in
 * parallel and {@code results} is in completion order. Only completed jobs expose their files.
 */
@Service
public class JobArtifacts {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobArtifacts.class);

  private final JobLifecycleManager manager;

  public JobArtifacts(JobLifecycleManager manager) {
    this.manager = manager;
  }

  /** A produced track file; {@code sizeBytes} is 0 when the file is missing. */
  public record TrackArtifact(Track track, Path file, boolean available, long sizeBytes) {

    /** Download name: {@code NN-<title>.<ext>}. */
    public String fileName() {
      String name = file.getFileName().toString();
      int dot = name.lastIndexOf('.');
      String extension = dot < 0 ? "" : name.substring(dot);
      return String.format(
          "%02d-%s%s",
          track.trackNumber(), FfmpegTrackSplitter.sanitizeFileName(track.name()), extension);
    }
  }

  /**
   * All tracks of a completed job that have a produced file, in track order.
   *
   * @throws com.scholary.djset.job.JobNotFoundException if the job is unknown
   * @throws JobNotCompleteException if the job has not completed
   */
  public List<TrackArtifact> tracks(String jobId) {
    JobSnapshot job = completedJob(jobId);
    Map<Integer, String> files = filesByTrackNumber(job);

    List<TrackArtifact> artifacts = new ArrayList<>();
    for (Track track : job.tracklist().tracks()) {
      String location = files.get(track.trackNumber());
      if (location == null) {
        continue;
      }
      Path file = Paths.get(location);
      boolean available = Files.isRegularFile(file);
      artifacts.add(new TrackArtifact(track, file, available, available ? sizeOf(file) : 0));
    }
    return artifacts;
  }

  /**
   * One track of a completed job.
   *
   * @throws ArtifactNotFoundException if the number is out of range or the file is missing
   */
  public TrackArtifact track(String jobId, int trackNumber) {
    TrackArtifact artifact =
        tracks(jobId).stream()
            .filter(candidate -> candidate.track().trackNumber() == trackNumber)
            .findFirst()
            .orElseThrow(() -> new ArtifactNotFoundException("Track not found: " + trackNumber));
    if (!artifact.available()) {
      throw new ArtifactNotFoundException("Track file not found: " + trackNumber);
    }
    return artifact;
  }

  /**
   * Check that every file of a completed job can be archived. Called before the archive response
   * is committed, so that missing files still produce an error status.
   *
   * @return the tracks to archive
   * @throws ArtifactNotFoundException if the job produced no files or one of them is missing
   */
  public List<TrackArtifact> archivable(String jobId) {
    List<TrackArtifact> artifacts = tracks(jobId);
    if (artifacts.isEmpty()) {
      throw new ArtifactNotFoundException("No tracks available for download");
    }
    for (TrackArtifact artifact : artifacts) {
      if (!artifact.available()) {
        throw new ArtifactNotFoundException(
            "Track file not found: " + artifact.track().trackNumber());
      }
    }
    return artifacts;
  }

  /**
   * Archive name: {@code <artist> - <name>.zip}, or {@code <jobId>.zip} when the tracklist carries
   * no set metadata.
   */
  public String archiveName(String jobId) {
    Tracklist tracklist = completedJob(jobId).tracklist();
    if (tracklist.artist() == null && tracklist.name() == null) {
      return jobId + ".zip";
    }
    return FfmpegTrackSplitter.sanitizeFileName(tracklist.artist())
        + " - "
        + FfmpegTrackSplitter.sanitizeFileName(tracklist.name())
        + ".zip";
  }

  /** Write the given tracks as a zip archive. The stream is not closed. */
  public void writeArchive(String jobId, List<TrackArtifact> artifacts, OutputStream out)
      throws IOException {
    ZipOutputStream zip = new ZipOutputStream(out);
    for (TrackArtifact artifact : artifacts) {
      zip.putNextEntry(new ZipEntry(artifact.fileName()));
      Files.copy(artifact.file(), zip);
      zip.closeEntry();
    }
    zip.finish();
    LOGGER.info("Wrote track archive: jobId={}, tracks={}", jobId, artifacts.size());
  }

  private JobSnapshot completedJob(String jobId) {
    JobSnapshot job = manager.get(jobId);
    if (job.status() != JobStatus.COMPLETE || job.tracklist() == null) {
      throw new JobNotCompleteException(jobId);
    }
    return job;
  }

  private static Map<Integer, String> filesByTrackNumber(JobSnapshot job) {
    Map<Integer, String> files = new HashMap<>();
    for (ProgressEvent event : job.events()) {
      if (event.trackDetails() != null && event.artifact() != null) {
        files.put(event.trackDetails().trackNumber(), event.artifact());
      }
    }
    return files;
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      LOGGER.warn("Cannot read size of {}: {}", file, e.getMessage());
      return 0;
    }
  }
}
