package com.scholary.djset.trackid;

/** The TrackID API could not be reached or answered with something unusable. */
public class TrackIdException extends RuntimeException {

  public TrackIdException(String message) {
    super(message);
  }

  public TrackIdException(String message, Throwable cause) {
    super(message, cause);
  }
}
