package com.scholary.djset.tracklist;

/** Thrown when a tracklist cannot be imported or reconciled. */
public class TracklistException extends RuntimeException {

  public TracklistException(String message) {
    super(message);
  }

  public TracklistException(String message, Throwable cause) {
    super(message, cause);
  }
}
