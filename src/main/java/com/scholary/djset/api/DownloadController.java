package com.scholary.djset.api;

import com.scholary.djset.service.JobArtifacts;
import com.scholary.djset.service.JobArtifacts.TrackArtifact;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Delivery of the tracks produced by completed jobs.
 *
 * <p>All endpoints answer 400 while the job is not complete and 404 for unknown jobs or tracks.
 */
@RestController
@RequestMapping("/api/jobs/{id}")
@Tag(name = "Downloads", description = "Download the tracks of completed jobs")
public class DownloadController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadController.class);
  private static final MediaType ZIP = MediaType.parseMediaType("application/zip");

  private final JobArtifacts artifacts;

  public DownloadController(JobArtifacts artifacts) {
    this.artifacts = artifacts;
  }

  @GetMapping("/tracks")
  @Operation(summary = "Get tracks", description = "Track metadata and download links")
  public TracksInfoResponse getTracks(@PathVariable String id) {
    return TracksInfoResponse.from(id, artifacts.tracks(id));
  }

  @GetMapping("/tracks/{trackNumber}/download")
  @Operation(summary = "Download track", description = "One track by its 1-based number")
  public ResponseEntity<Resource> downloadTrack(
      @PathVariable String id, @PathVariable int trackNumber) {
    TrackArtifact artifact = artifacts.track(id, trackNumber);
    String fileName = artifact.fileName();
    LOGGER.info("Track download: jobId={}, track={}", id, trackNumber);
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment(fileName))
        .contentType(
            MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM))
        .contentLength(artifact.sizeBytes())
        .body(new FileSystemResource(artifact.file()));
  }

  @GetMapping("/download")
  @Operation(summary = "Download all tracks", description = "Every track of the job as a zip")
  public ResponseEntity<StreamingResponseBody> downloadAll(@PathVariable String id) {
    List<TrackArtifact> tracks = artifacts.archivable(id);
    String archiveName = artifacts.archiveName(id);
    LOGGER.info("Archive download: jobId={}, tracks={}", id, tracks.size());
    StreamingResponseBody body = out -> artifacts.writeArchive(id, tracks, out);
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment(archiveName))
        .contentType(ZIP)
        .body(body);
  }

  private static String attachment(String fileName) {
    return ContentDisposition.attachment().filename(fileName).build().toString();
  }
}
