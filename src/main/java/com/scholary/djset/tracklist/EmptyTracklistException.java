package com.scholary.djset.tracklist;

public class EmptyTracklistException extends TracklistException {

  public EmptyTracklistException() {
    super("Tracklist contains no segments");
  }
}
