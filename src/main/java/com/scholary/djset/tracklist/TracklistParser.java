package com.scholary.djset.tracklist;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.djset.config.JobProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses the raw tracklist submitted with a job.
 *
 * <p>Two forms are accepted:
 *
 * <ul>
 *   <li>A JSON document: {@code {"name", "artist", "genre", "year", "tracks": [{"name", "artist",
 *       "start_time", "end_time"}]}}. Set name and artist are required.
 *   <li>Plain text with one track per line: {@code 1. Artist - Title 00:00-03:30}. The leading
 *       number and the end offset are optional. Blank lines and lines starting with {@code #} are
 *       skipped.
 * </ul>
 *
 * <p>Tracks are numbered 1..n in the order given. A missing end offset is filled with the next
 * track's start; the last track may stay open-ended.
 */
@Component
public class TracklistParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TracklistParser.class);

  private static final String OFFSET = "\\d{1,3}(?::\\d{1,2}){1,2}";

  // Example: 12. Artist Name - Track Title 1:02:03-1:07:45
  private static final Pattern TRACK_LINE =
      Pattern.compile(
          "^\\s*(?:\\d+[.)]\\s*)?(.+?)\\s+-\\s+(.+?)\\s+("
              + OFFSET
              + ")(?:\\s*-\\s*("
              + OFFSET
              + "))?\\s*$");

  private final ObjectMapper objectMapper;
  private final int maxTracks;

  public TracklistParser(ObjectMapper objectMapper, JobProperties properties) {
    this.objectMapper = objectMapper;
    this.maxTracks = properties.maxTracks();
  }

  /**
   * Parse a raw tracklist.
   *
   * @throws InvalidTracklistException if the input is malformed, empty, or too long
   */
  public Tracklist parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidTracklistException("tracklist is empty");
    }

    Tracklist tracklist = raw.trim().startsWith("{") ? parseJson(raw) : parseText(raw);

    if (tracklist.tracks().isEmpty()) {
      throw new InvalidTracklistException("at least one track is required");
    }
    if (tracklist.size() > maxTracks) {
      throw new InvalidTracklistException(
          String.format("maximum %d tracks allowed, got %d", maxTracks, tracklist.size()));
    }

    LOGGER.debug("Parsed tracklist: name={}, tracks={}", tracklist.name(), tracklist.size());
    return tracklist;
  }

  private Tracklist parseJson(String raw) {
    TracklistDocument document;
    try {
      document = objectMapper.readValue(raw, TracklistDocument.class);
    } catch (JsonProcessingException e) {
      throw new InvalidTracklistException(e.getOriginalMessage(), e);
    }

    if (isBlank(document.artist()) || isBlank(document.name())) {
      throw new InvalidTracklistException("artist and name are required");
    }

    List<TrackEntry> entries = document.tracks() == null ? List.of() : document.tracks();
    List<String> starts = new ArrayList<>();
    for (TrackEntry entry : entries) {
      starts.add(entry.startTime());
    }

    List<Track> tracks = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      TrackEntry entry = entries.get(i);
      if (isBlank(entry.name())) {
        throw new InvalidTracklistException("track " + (i + 1) + " has no name");
      }
      tracks.add(
          buildTrack(i + 1, entry.artist(), entry.name(), entry.startTime(), entry.endTime(), starts));
    }

    return new Tracklist(
        document.name(), document.artist(), document.genre(), document.year(), tracks);
  }

  private Tracklist parseText(String raw) {
    List<String[]> rows = new ArrayList<>();
    String[] lines = raw.split("\\r?\\n");
    for (int lineNumber = 1; lineNumber <= lines.length; lineNumber++) {
      String line = lines[lineNumber - 1].trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      Matcher matcher = TRACK_LINE.matcher(line);
      if (!matcher.matches()) {
        throw new InvalidTracklistException(
            String.format("line %d is not 'Artist - Title START[-END]': %s", lineNumber, line));
      }
      rows.add(
          new String[] {matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)});
    }

    List<String> starts = new ArrayList<>();
    for (String[] row : rows) {
      starts.add(row[2]);
    }

    List<Track> tracks = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      String[] row = rows.get(i);
      tracks.add(buildTrack(i + 1, row[0].trim(), row[1].trim(), row[2], row[3], starts));
    }
    return new Tracklist(null, null, null, null, tracks);
  }

  private Track buildTrack(
      int trackNumber,
      String artist,
      String name,
      String startTime,
      String endTime,
      List<String> starts) {

    if (!TimeOffsets.isValid(startTime)) {
      throw new InvalidTracklistException(
          "track " + trackNumber + " has an invalid start time: " + startTime);
    }
    String end = isBlank(endTime) ? null : endTime.trim();
    if (end == null && trackNumber < starts.size()) {
      end = starts.get(trackNumber);
    }
    if (end != null && !TimeOffsets.isValid(end)) {
      throw new InvalidTracklistException(
          "track " + trackNumber + " has an invalid end time: " + end);
    }
    try {
      double startSeconds = TimeOffsets.toSeconds(startTime);
      if (end != null && TimeOffsets.toSeconds(end) <= startSeconds) {
        throw new InvalidTracklistException(
            "track " + trackNumber + " ends before it starts: " + startTime + "-" + end);
      }
    } catch (IllegalArgumentException e) {
      throw new InvalidTracklistException("track " + trackNumber + ": " + e.getMessage(), e);
    }
    return new Track(artist, name, startTime.trim(), end, trackNumber);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TracklistDocument(
      String name, String artist, String genre, Integer year, List<TrackEntry> tracks) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TrackEntry(
      String name,
      String artist,
      @JsonAlias("start_time") String startTime,
      @JsonAlias("end_time") String endTime) {}
}
