package com.scholary.djset.api;

import com.scholary.djset.service.JobArtifacts.TrackArtifact;
import java.util.List;

/** Tracks of a completed job with their download links. */
public record TracksInfoResponse(
    String jobId, List<TrackInfo> tracks, int totalTracks, String downloadAllUrl) {

  public record TrackInfo(
      String name,
      String artist,
      String startTime,
      String endTime,
      int trackNumber,
      String downloadUrl,
      long sizeBytes,
      boolean available) {}

  public static TracksInfoResponse from(String jobId, List<TrackArtifact> artifacts) {
    List<TrackInfo> tracks =
        artifacts.stream()
            .map(
                artifact ->
                    new TrackInfo(
                        artifact.track().name(),
                        artifact.track().artist(),
                        artifact.track().startTime(),
                        artifact.track().endTime(),
                        artifact.track().trackNumber(),
                        String.format(
                            "/api/jobs/%s/tracks/%d/download",
                            jobId, artifact.track().trackNumber()),
                        artifact.sizeBytes(),
                        artifact.available()))
            .toList();
    return new TracksInfoResponse(
        jobId, tracks, tracks.size(), String.format("/api/jobs/%s/download", jobId));
  }
}
