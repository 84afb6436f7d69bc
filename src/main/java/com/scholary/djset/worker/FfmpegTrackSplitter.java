package com.scholary.djset.worker;

import com.scholary.djset.tracklist.TimeOffsets;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts one track out of a downloaded set using ffmpeg.
 *
 * <p>The segment is re-encoded into the requested format and tagged with title, artist, album and
 * track number. ffmpeg's combined output is drained while it runs; only the last lines are kept
 * for error messages.
 */
@Component
public class FfmpegTrackSplitter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTrackSplitter.class);
  private static final int OUTPUT_TAIL_LINES = 15;

  private final WorkerProperties properties;

  public FfmpegTrackSplitter(WorkerProperties properties) {
    this.properties = properties;
  }

  /**
   * Cut {@code track} from {@code input} into {@code outputDir}.
   *
   * @return the written file
   * @throws WorkerException if ffmpeg cannot be started or exits with an error
   * @throws JobCancelledException if the token is cancelled while ffmpeg runs
   */
  public Path split(
      Path input,
      Tracklist tracklist,
      Track track,
      AudioFormat format,
      Path outputDir,
      CancellationToken token) {

    token.throwIfCancelled();
    Path output = outputDir.resolve(outputFileName(track, format));
    List<String> command = buildCommand(input, tracklist, track, format, output);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      Files.createDirectories(outputDir);
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new WorkerException("Failed to start ffmpeg: " + e.getMessage(), e);
    }

    Runnable kill = process::destroyForcibly;
    token.onCancel(kill);
    try {
      String tail = drainOutput(process);
      int exitCode = process.waitFor();
      token.throwIfCancelled();
      if (exitCode != 0) {
        throw new WorkerException(
            String.format(
                "ffmpeg failed for track %d (%s) with exit code %d: %s",
                track.trackNumber(), track.name(), exitCode, tail));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new WorkerException("Track splitting interrupted", e);
    } catch (IOException e) {
      token.throwIfCancelled();
      throw new WorkerException("Failed to read ffmpeg output: " + e.getMessage(), e);
    } finally {
      token.removeCallback(kill);
    }

    LOGGER.debug("Split track {}: {}", track.trackNumber(), output);
    return output;
  }

  List<String> buildCommand(
      Path input, Tracklist tracklist, Track track, AudioFormat format, Path output) {
    double start = TimeOffsets.toSeconds(track.startTime());

    List<String> command = new ArrayList<>();
    command.add(properties.ffmpegPath());
    command.add("-y");
    command.add("-i");
    command.add(input.toString());
    command.add("-ss");
    command.add(String.format(Locale.ROOT, "%.3f", start));
    if (track.endTime() != null) {
      double duration = TimeOffsets.toSeconds(track.endTime()) - start;
      command.add("-t");
      command.add(String.format(Locale.ROOT, "%.3f", duration));
    }
    command.add("-map");
    command.add("0:a");
    command.add("-c:a");
    command.add(format.codec());
    command.add("-f");
    command.add(format.muxer());
    if (format == AudioFormat.MP3 || format == AudioFormat.M4A) {
      command.add("-b:a");
      command.add(properties.audioBitrate());
    }
    if (format == AudioFormat.MP3) {
      command.add("-id3v2_version");
      command.add("3");
    }

    addMetadata(command, "title", track.name());
    addMetadata(command, "artist", track.artist());
    addMetadata(command, "album", tracklist.name());
    addMetadata(command, "album_artist", tracklist.artist());
    addMetadata(command, "genre", tracklist.genre());
    addMetadata(command, "date", tracklist.year() == null ? null : tracklist.year().toString());
    addMetadata(command, "track", track.trackNumber() + "/" + tracklist.size());

    command.add(output.toString());
    return command;
  }

  static String outputFileName(Track track, AudioFormat format) {
    return String.format(
        "%02d-%s.%s", track.trackNumber(), sanitizeFileName(track.name()), format.extension());
  }

  /** Replace characters that are unsafe in file names; never returns an empty name. */
  public static String sanitizeFileName(String name) {
    if (name == null) {
      return "untitled";
    }
    String result = name.replaceAll("[/\\\\:*?\"<>|\\r\\n\\t]", "_").replace("..", "_");
    result = result.replaceAll("^[ .]+|[ .]+$", "");
    return result.isEmpty() ? "untitled" : result;
  }

  private static void addMetadata(List<String> command, String key, String value) {
    if (value != null && !value.isBlank()) {
      command.add("-metadata");
      command.add(key + "=" + value);
    }
  }

  private static String drainOutput(Process process) throws IOException {
    Deque<String> tail = new ArrayDeque<>();
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8), 8192)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (tail.size() == OUTPUT_TAIL_LINES) {
          tail.removeFirst();
        }
        tail.addLast(line);
      }
    }
    return String.join("\n", tail);
  }
}
