package com.scholary.djset.service;

/** The requested track of a job has no split file to serve. */
public class TrackNotAvailableException extends RuntimeException {

  public TrackNotAvailableException(String jobId, int trackNumber) {
    super(String.format("Track %d of job %s is not available", trackNumber, jobId));
  }
}
