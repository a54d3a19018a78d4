package com.scholary.djset.split;

import com.scholary.djset.audio.AudioEngine;
import com.scholary.djset.audio.SplitParams;
import com.scholary.djset.job.CancellationToken;
import com.scholary.djset.logging.StructuredLogger;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressListener;
import com.scholary.djset.progress.ProgressRange;
import com.scholary.djset.progress.TrackDetails;
import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Splits a downloaded mix into one file per track.
 *
 * <p>Every track is a unit of work submitted to the split executor. A semaphore sized to the
 * request's concurrency limit bounds how many units talk to the {@link AudioEngine} at once. Units
 * wait for a permit while polling the run's cancellation token, so a cancelled run drains quickly.
 *
 * <p>The first unit to fail records its error and cancels the rest of the run; later errors are
 * dropped. Engine calls already in flight are never interrupted: {@link #run} waits for them before
 * returning. Files written before a failure stay on disk.
 *
 * <p>Tracks are renumbered by position before splitting, so every track gets its own file. Results
 * are index-aligned with the tracklist regardless of completion order. Each completion reports
 * {@code 25 + completed / total * 74} percent.
 */
@Component
public class SplitPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final int DEFAULT_CONCURRENCY = 4;
  public static final int MAX_CONCURRENCY = 10;

  static final String COVER_ART_FILE = "cover.jpg";

  private final AudioEngine audioEngine;
  private final Executor executor;
  private final Duration permitPollInterval;

  @Autowired
  public SplitPipeline(AudioEngine audioEngine, @Qualifier("splitExecutor") Executor executor) {
    this(audioEngine, executor, Duration.ofMillis(100));
  }

  public SplitPipeline(AudioEngine audioEngine, Executor executor, Duration permitPollInterval) {
    this.audioEngine = audioEngine;
    this.executor = executor;
    this.permitPollInterval = permitPollInterval;
  }

  /**
   * Split every track of the request.
   *
   * @param listener receives one processing event per completed track
   * @param token the job's token; cancelling it stops units that have not started
   * @return output paths, one per track, in tracklist order
   * @throws SplitException if any track failed; carries the first failure
   * @throws CancellationException if the job token was cancelled or expired
   */
  public List<String> run(
      SplitRequest request, ProgressListener listener, CancellationToken token) {
    Tracklist tracklist = request.tracklist().renumbered();
    List<Track> tracks = tracklist.tracks();
    int total = tracks.size();
    if (total == 0) {
      return List.of();
    }
    token.throwIfCancelled();

    int limit = effectiveConcurrency(request.concurrencyLimit());
    Path setDirectory = FileNames.setDirectory(request.outputDir(), tracklist);
    Path coverArt = extractCoverArt(request.sourceFile());

    LOGGER.info(
        "Splitting {} tracks of '{}' into {} with concurrency {}",
        total,
        tracklist.name(),
        setDirectory,
        limit);

    Run run =
        new Run(request, tracklist, listener, token.child(), setDirectory, coverArt, limit, total);
    for (int i = 0; i < total; i++) {
      int index = i;
      try {
        executor.execute(() -> run.unit(index));
      } catch (RejectedExecutionException e) {
        run.fail(tracks.get(index), e);
        run.done.countDown();
      }
    }
    run.awaitCompletion();

    if (token.isCancelled()) {
      LOGGER.info("Split of '{}' cancelled after {} tracks", tracklist.name(), run.completed.get());
      throw new CancellationException(token.isExpired() ? "Deadline exceeded" : "Cancelled");
    }
    SplitException failure = run.firstError.get();
    if (failure != null) {
      throw failure;
    }
    if (run.token.isCancelled()) {
      throw new CancellationException("Interrupted");
    }
    return Collections.unmodifiableList(Arrays.asList(run.results));
  }

  static int effectiveConcurrency(int requested) {
    if (requested < 1 || requested > MAX_CONCURRENCY) {
      LOGGER.warn(
          "Concurrency limit {} outside [1, {}], using {}",
          requested,
          MAX_CONCURRENCY,
          DEFAULT_CONCURRENCY);
      return DEFAULT_CONCURRENCY;
    }
    return requested;
  }

  // A set without embedded artwork is split without a cover.
  private Path extractCoverArt(Path sourceFile) {
    Path cover = sourceFile.resolveSibling(COVER_ART_FILE);
    try {
      audioEngine.extractCoverArt(sourceFile, cover);
      return cover;
    } catch (IOException e) {
      LOGGER.warn("No cover art extracted from {}: {}", sourceFile, e.getMessage());
      return null;
    }
  }

  /** State shared by the units of one {@link #run} call. */
  private final class Run {
    private final SplitRequest request;
    private final Tracklist tracklist;
    private final ProgressListener listener;
    private final CancellationToken token;
    private final Path setDirectory;
    private final Path coverArt;
    private final Semaphore permits;
    private final int total;
    private final String[] results;
    private final CountDownLatch done;
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicReference<SplitException> firstError = new AtomicReference<>();
    private final Object progressLock = new Object();

    Run(
        SplitRequest request,
        Tracklist tracklist,
        ProgressListener listener,
        CancellationToken token,
        Path setDirectory,
        Path coverArt,
        int limit,
        int total) {
      this.request = request;
      this.tracklist = tracklist;
      this.listener = listener;
      this.token = token;
      this.setDirectory = setDirectory;
      this.coverArt = coverArt;
      this.permits = new Semaphore(limit);
      this.total = total;
      this.results = new String[total];
      this.done = new CountDownLatch(total);
    }

    void unit(int index) {
      Track track = tracklist.tracks().get(index);
      try {
        if (token.isCancelled() || !acquirePermit()) {
          return;
        }
        // the failure is recorded before the permit goes to a waiting unit
        try {
          if (!token.isCancelled()) {
            results[index] = split(track);
            reportCompletion(track);
          }
        } catch (Exception e) {
          fail(track, e);
        } finally {
          permits.release();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        fail(track, e);
      } finally {
        done.countDown();
      }
    }

    private boolean acquirePermit() throws InterruptedException {
      while (!permits.tryAcquire(permitPollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
        if (token.isCancelled()) {
          return false;
        }
      }
      return true;
    }

    private String split(Track track) throws IOException {
      STRUCTURED_LOGGER.logTrackSplitStarted(track.trackNumber(), total, track.title());
      long started = System.currentTimeMillis();

      Files.createDirectories(setDirectory);
      String output =
          audioEngine.split(
              new SplitParams(
                  request.sourceFile(),
                  setDirectory.resolve(FileNames.trackFileName(track)),
                  request.fileExtension(),
                  track,
                  total,
                  tracklist.artist(),
                  tracklist.name(),
                  coverArt));

      STRUCTURED_LOGGER.logTrackSplitFinished(
          track.trackNumber(), total, output, System.currentTimeMillis() - started);
      return output;
    }

    private void reportCompletion(Track track) {
      // Serialized so listeners observe non-decreasing progress.
      synchronized (progressLock) {
        int count = completed.incrementAndGet();
        TrackDetails details =
            new TrackDetails(track.trackNumber(), total, track.title(), count);
        try {
          listener.emit(
              ProgressEvent.trackProcessed(ProgressRange.processing(count, total), details));
        } catch (RuntimeException e) {
          LOGGER.warn("Progress listener failed for track {}", track.trackNumber(), e);
        }
      }
    }

    void fail(Track track, Exception cause) {
      SplitException error = new SplitException(track.trackNumber(), track.title(), cause);
      if (firstError.compareAndSet(null, error)) {
        STRUCTURED_LOGGER.logTrackSplitFailed(track.trackNumber(), track.title(), cause);
        token.cancel();
      } else {
        LOGGER.debug("Dropping later failure of track {}", track.trackNumber(), cause);
      }
    }

    // Interruption cancels the remaining units but still waits for in-flight engine calls.
    void awaitCompletion() {
      boolean interrupted = false;
      while (true) {
        try {
          done.await();
          break;
        } catch (InterruptedException e) {
          interrupted = true;
          token.cancel();
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
