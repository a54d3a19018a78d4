package com.scholary.djset.job;

import java.util.List;

public record JobPage(List<Job> jobs, int page, int pageSize, int totalJobs, int totalPages) {

  public JobPage {
    jobs = List.copyOf(jobs);
  }
}
