package com.scholary.djset.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a job as held by the {@link JobStore}.
 *
 * <p>{@code results} is index-aligned with {@code tracklist.tracks()}; entries for tracks that were
 * not split are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String id,
    JobStatus status,
    int progress,
    String message,
    String error,
    List<String> results,
    List<ProgressEvent> events,
    Instant startTime,
    Instant endTime,
    Tracklist tracklist) {

  public Job {
    results = results == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(results));
    events = events == null ? List.of() : List.copyOf(events);
  }

  public Job withTracklist(Tracklist replacement) {
    return new Job(
        id, status, progress, message, error, results, events, startTime, endTime, replacement);
  }
}
