package com.scholary.djset.tracklist;

public class TimestampFormatException extends TracklistException {

  public TimestampFormatException(String timestamp) {
    super("Invalid timestamp: '" + timestamp + "'");
  }

  public TimestampFormatException(String timestamp, Throwable cause) {
    super("Invalid timestamp: '" + timestamp + "'", cause);
  }
}
