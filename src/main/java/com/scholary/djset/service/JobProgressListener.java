package com.scholary.djset.service;

import com.scholary.djset.job.JobStore;
import com.scholary.djset.logging.StructuredLogger;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressListener;

/** Records progress events on a job and mirrors them into the log. */
class JobProgressListener implements ProgressListener {

  private final String jobId;
  private final JobStore jobStore;
  private final StructuredLogger structuredLogger;

  JobProgressListener(String jobId, JobStore jobStore, StructuredLogger structuredLogger) {
    this.jobId = jobId;
    this.jobStore = jobStore;
    this.structuredLogger = structuredLogger;
  }

  @Override
  public void emit(ProgressEvent event) {
    if (!jobStore.appendEvent(jobId, event)) {
      return;
    }
    jobStore.updateProgress(jobId, event.progress(), event.message());
    structuredLogger.logJobProgress(
        jobId, event.stage().value(), event.progress(), event.message());
  }
}
