package com.scholary.djset.job;

import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Mutable entry owned by {@link JobStore}. Only touched under the store's lock. */
class JobState {

  private final String id;
  private final Tracklist tracklist;
  private final Instant startTime;
  private final List<ProgressEvent> events = new ArrayList<>();
  private JobStatus status = JobStatus.PENDING;
  private int progress;
  private String message;
  private String error;
  private List<String> results = List.of();
  private Instant endTime;

  JobState(String id, Tracklist tracklist, Instant startTime, String message) {
    this.id = id;
    this.tracklist = tracklist;
    this.startTime = startTime;
    this.message = message;
  }

  String getId() {
    return id;
  }

  Instant getStartTime() {
    return startTime;
  }

  JobStatus getStatus() {
    return status;
  }

  void setStatus(JobStatus status) {
    this.status = status;
  }

  void setProgress(int progress) {
    this.progress = progress;
  }

  void setMessage(String message) {
    this.message = message;
  }

  void setError(String error) {
    this.error = error;
  }

  void setResults(List<String> results) {
    this.results = results;
  }

  void setEndTime(Instant endTime) {
    this.endTime = endTime;
  }

  void addEvent(ProgressEvent event) {
    events.add(event);
  }

  Job snapshot() {
    return new Job(
        id, status, progress, message, error, results, events, startTime, endTime, tracklist);
  }
}
