package com.scholary.djset.tracklist;

/**
 * Conversion between tracklist timestamps and whole seconds.
 *
 * <p>Accepted forms are {@code H:MM:SS}, {@code HH:MM:SS} and {@code MM:SS}, each with an optional
 * fractional part on the seconds ({@code 01:02:03.500}). Fractions are dropped.
 */
public final class Timestamps {

  private Timestamps() {}

  public static boolean isBlank(String timestamp) {
    return timestamp == null || timestamp.isBlank();
  }

  /**
   * Parse a timestamp into whole seconds.
   *
   * @throws TimestampFormatException if the value is blank or not a timestamp
   */
  public static int toSeconds(String timestamp) {
    if (isBlank(timestamp)) {
      throw new TimestampFormatException(String.valueOf(timestamp));
    }
    String value = timestamp.trim();
    int dot = value.indexOf('.');
    if (dot >= 0) {
      value = value.substring(0, dot);
    }

    String[] parts = value.split(":", -1);
    if (parts.length < 2 || parts.length > 3) {
      throw new TimestampFormatException(timestamp);
    }

    try {
      int seconds = 0;
      for (int i = 0; i < parts.length; i++) {
        int part = Integer.parseInt(parts[i]);
        // hours are unbounded; minutes and seconds are base 60
        if (part < 0 || (i > 0 && part > 59) || parts[i].isEmpty()) {
          throw new TimestampFormatException(timestamp);
        }
        seconds = seconds * 60 + part;
      }
      return seconds;
    } catch (NumberFormatException e) {
      throw new TimestampFormatException(timestamp, e);
    }
  }

  /** Format whole seconds as {@code HH:MM:SS}. */
  public static String format(int totalSeconds) {
    if (totalSeconds < 0) {
      throw new IllegalArgumentException("Seconds cannot be negative: " + totalSeconds);
    }
    int hours = totalSeconds / 3600;
    int minutes = (totalSeconds % 3600) / 60;
    int seconds = totalSeconds % 60;
    return String.format("%02d:%02d:%02d", hours, minutes, seconds);
  }
}
