package com.scholary.djset.job;

/** Thrown when an operation is not allowed in the job's current state. */
public class InvalidJobStateException extends RuntimeException {

  private final JobStatus status;

  public InvalidJobStateException(String jobId, JobStatus status, String operation) {
    super(String.format("Cannot %s job %s in state %s", operation, jobId, status.value()));
    this.status = status;
  }

  public JobStatus getStatus() {
    return status;
  }
}
