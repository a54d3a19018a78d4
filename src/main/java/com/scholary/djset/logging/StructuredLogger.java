package com.scholary.djset.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs job and track events with MDC fields so they can be filtered in the log pipeline.
 *
 * <p>Event fields are removed again after each call. Job context fields stay until {@link
 * #clearJobContext()}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  public void logTrackSplitStarted(int trackNumber, int totalTracks, String title) {
    try {
      MDC.put("event_type", "track_split_started");
      MDC.put("trackNumber", String.valueOf(trackNumber));
      MDC.put("totalTracks", String.valueOf(totalTracks));

      logger.debug("Track split started: track={}/{}, title={}", trackNumber, totalTracks, title);
    } finally {
      clearEventFields();
    }
  }

  public void logTrackSplitFinished(
      int trackNumber, int totalTracks, String outputPath, long elapsedMs) {
    try {
      MDC.put("event_type", "track_split_finished");
      MDC.put("trackNumber", String.valueOf(trackNumber));
      MDC.put("totalTracks", String.valueOf(totalTracks));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Track split finished: track={}/{}, output={}, took={}ms",
          trackNumber,
          totalTracks,
          outputPath,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  public void logTrackSplitFailed(int trackNumber, String title, Throwable error) {
    try {
      MDC.put("event_type", "track_split_failed");
      MDC.put("trackNumber", String.valueOf(trackNumber));
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error(
          "Track split failed: track={}, title={}, error={}",
          trackNumber,
          title,
          error.getMessage());
    } finally {
      clearEventFields();
    }
  }

  public void logJobProgress(String jobId, String stage, int percentComplete, String message) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("stage", stage);
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, stage={}, progress={}%, message={}",
          jobId,
          stage,
          percentComplete,
          message);
    } finally {
      clearEventFields();
    }
  }

  public void logJobFinished(String jobId, String status, long elapsedMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Job finished: jobId={}, status={}, took={}ms", jobId, status, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String setName, String sourceUrl) {
    MDC.put("jobId", jobId);
    MDC.put("setName", setName);
    MDC.put("sourceUrl", sourceUrl);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("setName");
    MDC.remove("sourceUrl");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("trackNumber");
    MDC.remove("totalTracks");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("stage");
    MDC.remove("percentComplete");
    MDC.remove("status");
  }
}
