package com.scholary.djset.tracklist;

import java.util.regex.Pattern;

/** Conversion of tracklist offsets such as {@code 3:45} or {@code 1:02:03} to seconds. */
public final class TimeOffsets {

  private static final Pattern OFFSET = Pattern.compile("\\d{1,3}(:\\d{1,2}){1,2}(\\.\\d+)?");

  private TimeOffsets() {}

  public static boolean isValid(String offset) {
    return offset != null && OFFSET.matcher(offset.trim()).matches();
  }

  /**
   * Parse an offset into seconds.
   *
   * @throws IllegalArgumentException if the offset is not {@code MM:SS} or {@code H:MM:SS}
   */
  public static double toSeconds(String offset) {
    if (!isValid(offset)) {
      throw new IllegalArgumentException("Invalid time offset: " + offset);
    }
    String[] parts = offset.trim().split(":");
    double seconds = Double.parseDouble(parts[parts.length - 1]);
    double minutes = Double.parseDouble(parts[parts.length - 2]);
    double hours = parts.length == 3 ? Double.parseDouble(parts[0]) : 0;
    if (seconds >= 60 || (parts.length == 3 && minutes >= 60)) {
      throw new IllegalArgumentException("Invalid time offset: " + offset);
    }
    return hours * 3600 + minutes * 60 + seconds;
  }
}
