package com.scholary.djset.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.tracklist.Tracklist;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of split jobs.
 *
 * <p>Jobs move {@code pending -> processing -> completed | failed | cancelled}. Terminal states are
 * absorbing: later updates are ignored. Callers only ever see {@link Job} snapshots taken under the
 * lock; cancellation tokens live in a side table and never leave the store except through {@link
 * #createJob}.
 *
 * <p>Pending and processing jobs are held until they finish and are never evicted. Finished jobs
 * move to a Caffeine cache bounded by {@code jobstore.max-size} and {@code jobstore.retention},
 * counted from the moment the job finished. With both at zero (the default) nothing is evicted for
 * the lifetime of the process.
 */
@Repository
public class JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStore.class);

  public static final int DEFAULT_PAGE_SIZE = 10;
  public static final int MAX_PAGE_SIZE = 100;

  private static final Comparator<JobState> CREATION_ORDER =
      Comparator.comparing(JobState::getStartTime).thenComparing(JobState::getId);

  private final Map<String, JobState> active = new ConcurrentHashMap<>();
  private final Cache<String, JobState> finished;
  private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicLong lastId = new AtomicLong();
  private final Clock clock;

  @Autowired
  public JobStore(
      @Value("${jobstore.max-size:0}") long maxSize,
      @Value("${jobstore.retention:0s}") Duration retention) {
    this(maxSize, retention, Clock.systemUTC());
  }

  public JobStore(long maxSize, Duration retention, Clock clock) {
    this.clock = clock;

    Caffeine<Object, Object> builder =
        Caffeine.newBuilder().ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()));
    if (maxSize > 0) {
      builder.maximumSize(maxSize);
    }
    if (retention != null && !retention.isZero() && !retention.isNegative()) {
      builder.expireAfterWrite(retention);
    }
    this.finished =
        builder
            .<String, JobState>removalListener(
                (id, state, cause) -> {
                  if (cause.wasEvicted()) {
                    LOGGER.debug("Evicted finished job {} ({})", id, cause);
                  }
                })
            .build();
  }

  /** Register a new pending job for the given tracklist. */
  public JobHandle createJob(Tracklist tracklist) {
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      String id = nextId(now);
      JobState state = new JobState(id, tracklist, now, "Job created");
      if (finished.getIfPresent(id) != null || active.putIfAbsent(id, state) != null) {
        throw new IllegalStateException("Duplicate job id: " + id);
      }
      CancellationToken token = CancellationToken.create();
      tokens.put(id, token);

      LOGGER.info("Created job {} for set '{}'", id, tracklist.name());
      return new JobHandle(state.snapshot(), token);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @throws JobNotFoundException if no job has this id
   */
  public Job getJob(String id) {
    lock.readLock().lock();
    try {
      return require(id).snapshot();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Overwrite progress and message. The percentage is not range-checked.
   *
   * @return false if the job is already terminal and the update was ignored
   */
  public boolean updateProgress(String id, int percent, String message) {
    lock.writeLock().lock();
    try {
      JobState state = require(id);
      if (state.getStatus().isTerminal()) {
        LOGGER.debug("Ignoring progress update for terminal job {}", id);
        return false;
      }
      state.setProgress(percent);
      state.setMessage(message);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Move a job to a new status.
   *
   * <p>{@code completed} forces progress to 100, any terminal status stamps the end time, and
   * {@code failed} records the message as the error. A null {@code results} keeps the current
   * results.
   *
   * @return false if the job was already terminal and nothing changed
   */
  public boolean updateStatus(String id, JobStatus status, List<String> results, String message) {
    lock.writeLock().lock();
    try {
      JobState state = require(id);
      if (state.getStatus().isTerminal()) {
        LOGGER.info(
            "Ignoring transition of job {} from {} to {}",
            id,
            state.getStatus().value(),
            status.value());
        return false;
      }

      state.setStatus(status);
      state.setMessage(message);
      if (results != null) {
        state.setResults(results);
      }
      if (status == JobStatus.COMPLETED) {
        state.setProgress(100);
      }
      if (status == JobStatus.FAILED) {
        state.setError(message);
      }
      if (status.isTerminal()) {
        state.setEndTime(clock.instant());
        retire(id, state);
      }

      LOGGER.info("Job {} is now {}: {}", id, status.value(), message);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Append to the job's event trail.
   *
   * @return false if the job is already terminal and the event was dropped
   */
  public boolean appendEvent(String id, ProgressEvent event) {
    lock.writeLock().lock();
    try {
      JobState state = require(id);
      if (state.getStatus().isTerminal()) {
        return false;
      }
      state.addEvent(event);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Cancel a pending or processing job and signal its token.
   *
   * @throws JobNotFoundException if no job has this id
   * @throws InvalidJobStateException if the job is already terminal
   */
  public Job cancelJob(String id) {
    lock.writeLock().lock();
    try {
      JobState state = require(id);
      if (state.getStatus() != JobStatus.PENDING && state.getStatus() != JobStatus.PROCESSING) {
        throw new InvalidJobStateException(id, state.getStatus(), "cancel");
      }

      CancellationToken token = tokens.get(id);
      if (token != null) {
        token.cancel();
      }
      state.setStatus(JobStatus.CANCELLED);
      state.setMessage("cancelled by caller");
      state.setEndTime(clock.instant());
      retire(id, state);

      LOGGER.info("Cancelled job {}", id);
      return state.snapshot();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * List jobs in creation order.
   *
   * <p>A page below 1 is treated as 1. A page size outside {@code [1, MAX_PAGE_SIZE]} falls back to
   * {@link #DEFAULT_PAGE_SIZE}. Pages past the end are empty but carry the correct totals.
   */
  public JobPage listJobs(int page, int pageSize) {
    int effectivePage = Math.max(page, 1);
    int effectiveSize = pageSize < 1 || pageSize > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : pageSize;

    lock.readLock().lock();
    try {
      List<JobState> ordered =
          Stream.concat(active.values().stream(), finished.asMap().values().stream())
              .sorted(CREATION_ORDER)
              .toList();
      int total = ordered.size();
      int totalPages = (total + effectiveSize - 1) / effectiveSize;

      long from = (long) (effectivePage - 1) * effectiveSize;
      List<Job> slice =
          from >= total
              ? List.of()
              : ordered.subList((int) from, (int) Math.min(total, from + effectiveSize)).stream()
                  .map(JobState::snapshot)
                  .toList();

      return new JobPage(slice, effectivePage, effectiveSize, total, totalPages);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Like {@link #getJob} but empty once the job is unknown or evicted. */
  public Optional<Job> findJob(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(lookup(id)).map(JobState::snapshot);
    } finally {
      lock.readLock().unlock();
    }
  }

  private JobState require(String id) {
    JobState state = lookup(id);
    if (state == null) {
      throw new JobNotFoundException(id);
    }
    return state;
  }

  private JobState lookup(String id) {
    if (id == null) {
      return null;
    }
    JobState state = active.get(id);
    return state != null ? state : finished.getIfPresent(id);
  }

  // Retention and size bounds start to apply once a job has finished.
  private void retire(String id, JobState state) {
    tokens.remove(id);
    active.remove(id);
    finished.put(id, state);
  }

  // Nanosecond timestamp, bumped when the clock has not moved since the previous id.
  private String nextId(Instant now) {
    long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
    return Long.toString(lastId.updateAndGet(previous -> Math.max(previous + 1, nanos)));
  }
}
