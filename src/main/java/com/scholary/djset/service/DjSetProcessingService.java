package com.scholary.djset.service;

import com.scholary.djset.audio.AudioFormat;
import com.scholary.djset.config.SplitterProperties;
import com.scholary.djset.download.Downloader;
import com.scholary.djset.job.CancellationToken;
import com.scholary.djset.job.InvalidJobStateException;
import com.scholary.djset.job.Job;
import com.scholary.djset.job.JobHandle;
import com.scholary.djset.job.JobNotFoundException;
import com.scholary.djset.job.JobStatus;
import com.scholary.djset.job.JobStore;
import com.scholary.djset.logging.StructuredLogger;
import com.scholary.djset.objectstore.TrackPublisher;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressListener;
import com.scholary.djset.progress.ProgressRange;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.split.SplitPipeline;
import com.scholary.djset.split.SplitRequest;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import com.scholary.djset.tracklist.TracklistException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleConsumer;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs split jobs end to end: download, split, optional publish.
 *
 * <p>{@link #submit} registers the job and returns immediately; the work happens on the job
 * executor. Progress is two-phase: the download maps into {@code [0, 25)}, splitting into {@code
 * [25, 99]} and completion reports 100. Each job has a deadline after which its token expires and
 * the job fails.
 *
 * <p>The per-job temp directory is always removed. Split tracks stay in the output directory.
 */
@Service
public class DjSetProcessingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DjSetProcessingService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final Downloader downloader;
  private final SplitPipeline splitPipeline;
  private final Optional<TrackPublisher> trackPublisher;
  private final SplitterProperties properties;
  private final Executor jobExecutor;
  private final TaskScheduler deadlineScheduler;
  private final Path tempRoot;
  private final Path outputRoot;

  public DjSetProcessingService(
      JobStore jobStore,
      Downloader downloader,
      SplitPipeline splitPipeline,
      Optional<TrackPublisher> trackPublisher,
      SplitterProperties properties,
      @Qualifier("jobExecutor") Executor jobExecutor,
      @Qualifier("jobDeadlineScheduler") TaskScheduler deadlineScheduler) {
    this.jobStore = jobStore;
    this.downloader = downloader;
    this.splitPipeline = splitPipeline;
    this.trackPublisher = trackPublisher;
    this.properties = properties;
    this.jobExecutor = jobExecutor;
    this.deadlineScheduler = deadlineScheduler;
    this.tempRoot = Path.of(properties.tempDir());
    this.outputRoot = Path.of(properties.outputDir());

    try {
      Files.createDirectories(tempRoot);
      Files.createDirectories(outputRoot);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create working directories", e);
    }
  }

  /**
   * Validate the request, register a job and start processing it in the background.
   *
   * @param fileExtension output format; null or blank selects the configured default
   * @param maxConcurrentTasks tracks split at once; null selects the pipeline default
   * @return the new job's id
   * @throws TracklistException if the tracklist is missing, too long or names unsafe paths
   * @throws IllegalArgumentException if the file extension is not supported
   */
  public String submit(
      String url, Tracklist tracklist, String fileExtension, Integer maxConcurrentTasks) {
    validate(tracklist);
    String extension =
        fileExtension == null || fileExtension.isBlank()
            ? properties.defaultFileExtension()
            : fileExtension;
    AudioFormat format =
        AudioFormat.fromExtension(extension)
            .orElseThrow(
                () -> new IllegalArgumentException("Unsupported file extension: " + extension));
    int concurrency =
        maxConcurrentTasks == null ? SplitPipeline.DEFAULT_CONCURRENCY : maxConcurrentTasks;

    JobHandle handle = jobStore.createJob(tracklist.renumbered());
    String jobId = handle.jobId();
    try {
      jobExecutor.execute(() -> process(handle, url, format, concurrency));
    } catch (RejectedExecutionException e) {
      jobStore.updateStatus(jobId, JobStatus.FAILED, null, "Job queue is full");
      throw e;
    }

    LOGGER.info("Submitted job {} for {} ({} tracks)", jobId, url, tracklist.tracks().size());
    return jobId;
  }

  /**
   * Snapshot of a job. Completed jobs get their tracks annotated with download links, size and
   * availability of the split file.
   */
  public Job getJob(String jobId) {
    Job job = jobStore.getJob(jobId);
    if (job.status() != JobStatus.COMPLETED || job.tracklist() == null) {
      return job;
    }

    List<Track> tracks = job.tracklist().tracks();
    List<Track> annotated = new ArrayList<>(tracks.size());
    for (int i = 0; i < tracks.size(); i++) {
      Track track = tracks.get(i);
      String result = i < job.results().size() ? job.results().get(i) : null;
      boolean available = result != null && Files.isRegularFile(Path.of(result));
      long size = available ? sizeOf(Path.of(result)) : 0L;
      annotated.add(
          track.withDownload(
              String.format("/api/jobs/%s/tracks/%d/download", jobId, track.trackNumber()),
              size,
              available));
    }
    return job.withTracklist(job.tracklist().withTracks(annotated));
  }

  /**
   * Resolve the split file of one track of a completed job.
   *
   * @throws JobNotFoundException if the job is unknown
   * @throws InvalidJobStateException if the job has not completed
   * @throws TrackNotAvailableException if the track does not exist or its file is gone
   */
  public Path trackFile(String jobId, int trackNumber) {
    Job job = jobStore.getJob(jobId);
    if (job.status() != JobStatus.COMPLETED) {
      throw new InvalidJobStateException(jobId, job.status(), "download tracks of");
    }
    int index = trackNumber - 1;
    if (index < 0 || index >= job.results().size() || job.results().get(index) == null) {
      throw new TrackNotAvailableException(jobId, trackNumber);
    }
    Path file = Path.of(job.results().get(index));
    if (!Files.isRegularFile(file)) {
      throw new TrackNotAvailableException(jobId, trackNumber);
    }
    return file;
  }

  public Optional<TrackPublisher> trackPublisher() {
    return trackPublisher;
  }

  void process(JobHandle handle, String url, AudioFormat format, int concurrency) {
    String jobId = handle.jobId();
    CancellationToken token = handle.token();
    Tracklist tracklist = handle.job().tracklist();
    ProgressListener listener = new JobProgressListener(jobId, jobStore, STRUCTURED_LOGGER);
    long started = System.currentTimeMillis();

    StructuredLogger.setJobContext(jobId, tracklist.name(), url);
    ScheduledFuture<?> deadline =
        deadlineScheduler.schedule(
            () -> expire(jobId, token), Instant.now().plus(properties.jobTimeout()));
    Path workDir = tempRoot.resolve(jobId);
    try {
      if (!jobStore.updateStatus(jobId, JobStatus.PROCESSING, null, "Downloading set")) {
        return;
      }
      token.throwIfCancelled();

      Files.createDirectories(workDir);
      listener.emit(
          ProgressEvent.of(ProgressStage.DOWNLOADING, ProgressRange.DOWNLOAD_START, "Downloading"));
      Path source = downloader.download(url, workDir, downloadProgress(listener), token);
      token.throwIfCancelled();

      int total = tracklist.tracks().size();
      listener.emit(
          ProgressEvent.of(
              ProgressStage.PROCESSING,
              ProgressRange.PROCESSING_START,
              "Splitting " + total + " tracks"));
      List<String> results =
          splitPipeline.run(
              new SplitRequest(tracklist, source, outputRoot, format.extension(), concurrency),
              listener,
              token);

      if (trackPublisher.isPresent()) {
        trackPublisher.get().publish(results);
      }

      listener.emit(
          ProgressEvent.of(
                  ProgressStage.COMPLETE, ProgressRange.COMPLETE, "Split " + total + " tracks")
              .withData(Map.<String, Object>of("results", results)));
      jobStore.updateStatus(jobId, JobStatus.COMPLETED, results, "Split " + total + " tracks");

    } catch (CancellationException e) {
      if (token.isExpired()) {
        jobStore.updateStatus(jobId, JobStatus.FAILED, null, timeoutMessage());
      } else {
        jobStore.updateStatus(jobId, JobStatus.CANCELLED, null, "cancelled");
      }
    } catch (Exception e) {
      LOGGER.error("Job {} failed", jobId, e);
      String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      int progress = jobStore.findJob(jobId).map(Job::progress).orElse(0);
      listener.emit(ProgressEvent.failure(progress, "Job failed", message));
      jobStore.updateStatus(jobId, JobStatus.FAILED, null, message);
    } finally {
      deadline.cancel(false);
      deleteRecursively(workDir);
      String outcome = jobStore.findJob(jobId).map(job -> job.status().value()).orElse("evicted");
      STRUCTURED_LOGGER.logJobFinished(jobId, outcome, System.currentTimeMillis() - started);
      StructuredLogger.clearJobContext();
    }
  }

  private void expire(String jobId, CancellationToken token) {
    if (token.expire()) {
      LOGGER.warn("Job {} exceeded its deadline of {}", jobId, properties.jobTimeout());
      jobStore.updateStatus(jobId, JobStatus.FAILED, null, timeoutMessage());
    }
  }

  private String timeoutMessage() {
    return "Job timed out after " + properties.jobTimeout();
  }

  private void validate(Tracklist tracklist) {
    if (tracklist == null || tracklist.tracks().isEmpty()) {
      throw new TracklistException("Tracklist must contain at least one track");
    }
    if (tracklist.tracks().size() > properties.maxTracks()) {
      throw new TracklistException(
          String.format(
              "Tracklist has %d tracks, at most %d are allowed",
              tracklist.tracks().size(), properties.maxTracks()));
    }
    if (isUnsafe(tracklist.name()) || isUnsafe(tracklist.artist())) {
      throw new TracklistException("Set name and artist must not contain path separators or '..'");
    }
  }

  private static boolean isUnsafe(String value) {
    return value != null && (value.contains("/") || value.contains("\\") || value.contains(".."));
  }

  // Whole percentages only, so the event trail stays short.
  private static DoubleConsumer downloadProgress(ProgressListener listener) {
    AtomicInteger last = new AtomicInteger(-1);
    return fraction -> {
      int percent = (int) (Math.max(0.0, Math.min(1.0, fraction)) * 100);
      if (last.getAndSet(percent) != percent) {
        listener.emit(
            ProgressEvent.of(
                ProgressStage.DOWNLOADING,
                ProgressRange.download(fraction),
                "Downloaded " + percent + "%"));
      }
    };
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      LOGGER.warn("Could not read size of {}", file, e);
      return 0L;
    }
  }

  private static void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(DjSetProcessingService::deletePath);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up {}", dir, e);
    }
  }

  private static void deletePath(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}", path, e);
    }
  }
}
