package com.scholary.djset.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/**
 * One entry of a job's progress trail.
 *
 * <p>{@code progress} is a percentage on the job-wide scale described by {@link ProgressRange}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    ProgressStage stage,
    int progress,
    String message,
    Instant timestamp,
    Map<String, Object> data,
    String error,
    TrackDetails trackDetails) {

  public ProgressEvent {
    data = data == null ? null : Map.copyOf(data);
  }

  public static ProgressEvent of(ProgressStage stage, int progress, String message) {
    return new ProgressEvent(stage, progress, message, Instant.now(), null, null, null);
  }

  public static ProgressEvent failure(int progress, String message, String error) {
    return new ProgressEvent(
        ProgressStage.ERROR, progress, message, Instant.now(), null, error, null);
  }

  public static ProgressEvent trackProcessed(int progress, TrackDetails details) {
    return new ProgressEvent(
        ProgressStage.PROCESSING,
        progress,
        String.format(
            "Processed track %d of %d: %s",
            details.trackNumber(), details.totalTracks(), details.currentTrack()),
        Instant.now(),
        null,
        null,
        details);
  }

  /** Copy carrying extra payload, e.g. the output paths on the final event. */
  public ProgressEvent withData(Map<String, Object> extra) {
    return new ProgressEvent(stage, progress, message, timestamp, extra, error, trackDetails);
  }
}
