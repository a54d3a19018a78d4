package com.scholary.djset.split;

/** The first track that failed to split in a pipeline run. */
public class SplitException extends RuntimeException {

  private final int trackNumber;
  private final String title;

  public SplitException(int trackNumber, String title, Throwable cause) {
    super(
        String.format(
            "Failed to split track %d (%s): %s", trackNumber, title, cause.getMessage()),
        cause);
    this.trackNumber = trackNumber;
    this.title = title;
  }

  public int getTrackNumber() {
    return trackNumber;
  }

  public String getTitle() {
    return title;
  }
}
