package com.scholary.djset.job;

/** A freshly created job together with the token that cancels it. */
public record JobHandle(Job job, CancellationToken token) {

  public String jobId() {
    return job.id();
  }
}
