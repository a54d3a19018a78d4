package com.scholary.djset.tracklist;

/** The total duration of a set is unparseable or inconsistent with its last track. */
public class InvalidDurationException extends TracklistException {

  public InvalidDurationException(String message) {
    super(message);
  }

  public InvalidDurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
