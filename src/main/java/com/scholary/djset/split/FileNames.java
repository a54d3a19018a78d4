package com.scholary.djset.split;

import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import java.nio.file.Path;

/** File and directory naming for split output. */
public final class FileNames {

  private static final String UNSAFE_CHARACTERS = "/\\:*?\"<>|";

  private FileNames() {}

  /**
   * Make a value safe to use as a single path element.
   *
   * <p>Path separators, characters Windows rejects, {@code ..} and control characters become
   * {@code _}. Leading and trailing spaces and dots are trimmed; nothing left means {@code
   * untitled}.
   */
  public static String sanitize(String value) {
    if (value == null) {
      return "untitled";
    }
    StringBuilder safe = new StringBuilder(value.length());
    for (char c : value.replace("..", "_").toCharArray()) {
      safe.append(UNSAFE_CHARACTERS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
    }

    String trimmed = safe.toString();
    int begin = 0;
    int end = trimmed.length();
    while (begin < end && isTrimmed(trimmed.charAt(begin))) {
      begin++;
    }
    while (end > begin && isTrimmed(trimmed.charAt(end - 1))) {
      end--;
    }
    trimmed = trimmed.substring(begin, end);
    return trimmed.isEmpty() ? "untitled" : trimmed;
  }

  /** Directory holding all tracks of a set: {@code "<artist> - <name>"}, or the name alone. */
  public static Path setDirectory(Path outputRoot, Tracklist tracklist) {
    String artist = tracklist.artist();
    String label =
        artist == null || artist.isBlank() ? tracklist.name() : artist + " - " + tracklist.name();
    return outputRoot.resolve(sanitize(label));
  }

  /** Track file name without extension, e.g. {@code "03 - Heavy Handed Sunset"}. */
  public static String trackFileName(Track track) {
    return String.format("%02d - %s", track.trackNumber(), sanitize(track.title()));
  }

  private static boolean isTrimmed(char c) {
    return c == ' ' || c == '.';
  }
}
