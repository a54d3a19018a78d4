package com.scholary.djset.download;

import com.scholary.djset.job.CancellationToken;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.DoubleConsumer;

/** Fetches the source mix of a job. */
public interface Downloader {

  /**
   * Download {@code url} into {@code outputDir}.
   *
   * @param progress receives the downloaded fraction in {@code [0, 1]} when the size is known
   * @return path of the downloaded file
   * @throws java.util.concurrent.CancellationException if the token is cancelled mid-download
   */
  Path download(String url, Path outputDir, DoubleConsumer progress, CancellationToken token)
      throws IOException;
}
