package com.scholary.djset.worker;

import java.util.Arrays;
import java.util.Optional;

/** Output formats the splitter can produce, with the ffmpeg codec and muxer for each. */
public enum AudioFormat {
  MP3("mp3", "libmp3lame", "mp3"),
  M4A("m4a", "aac", "mp4"),
  WAV("wav", "pcm_s16le", "wav"),
  FLAC("flac", "flac", "flac");

  private final String extension;
  private final String codec;
  private final String muxer;

  AudioFormat(String extension, String codec, String muxer) {
    this.extension = extension;
    this.codec = codec;
    this.muxer = muxer;
  }

  public String extension() {
    return extension;
  }

  public String codec() {
    return codec;
  }

  public String muxer() {
    return muxer;
  }

  public static Optional<AudioFormat> fromExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    String normalized = extension.trim().toLowerCase();
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    String wanted = normalized;
    return Arrays.stream(values()).filter(f -> f.extension.equals(wanted)).findFirst();
  }
}
