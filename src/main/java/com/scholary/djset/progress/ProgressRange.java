package com.scholary.djset.progress;

/**
 * Job-wide progress scale.
 *
 * <p>Downloading occupies {@code [0, 25)}, splitting {@code [25, 99]}, and {@code 100} is only
 * reported once the job has completed.
 */
public final class ProgressRange {

  public static final int DOWNLOAD_START = 0;
  public static final int DOWNLOAD_END = 25;
  public static final int PROCESSING_START = 25;
  public static final int PROCESSING_END = 99;
  public static final int COMPLETE = 100;

  private ProgressRange() {}

  /** Map a download fraction in {@code [0, 1]} onto the download range. */
  public static int download(double fraction) {
    double clamped = Math.max(0.0, Math.min(1.0, fraction));
    int value = DOWNLOAD_START + (int) (clamped * (DOWNLOAD_END - DOWNLOAD_START));
    return Math.min(value, DOWNLOAD_END - 1);
  }

  /** Map {@code completed} of {@code total} split tracks onto the processing range. */
  public static int processing(int completed, int total) {
    if (total <= 0) {
      return PROCESSING_START;
    }
    int span = PROCESSING_END - PROCESSING_START;
    return PROCESSING_START + (int) ((double) completed / total * span);
  }
}
