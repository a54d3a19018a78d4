package com.scholary.djset.tracklist;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw, possibly gappy segment timings into a contiguous tracklist covering the whole set.
 *
 * <p>Rules, applied in order:
 *
 * <ol>
 *   <li>If the first segment does not start at zero, an {@code ID} track covers the lead-in.
 *   <li>A gap under {@value #GAP_THRESHOLD_SECONDS}s between two segments is bridged at its
 *       midpoint. A larger gap gets its own {@code ID} track. Overlaps are left alone.
 *   <li>The gap between the last segment and the total duration follows the same threshold: a
 *       short one extends the last track, a long one becomes a trailing {@code ID} track.
 *   <li>Tracks are numbered from 1 and the last track's end time is cleared.
 * </ol>
 *
 * <p>Stateless and free of I/O. Every importer goes through this class.
 */
@Component
public class TimingReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingReconciler.class);

  static final int GAP_THRESHOLD_SECONDS = 60;
  static final int MAX_TRAILING_GAP_SECONDS = 24 * 60 * 60;

  public Tracklist reconcile(
      String name, String artist, List<RawSegment> rawSegments, String totalDuration) {
    return new Tracklist(name, artist, reconcile(rawSegments, totalDuration));
  }

  /**
   * Reconcile segments against the total duration of the set.
   *
   * @param rawSegments segments in playback order
   * @param totalDuration length of the whole set as a timestamp
   * @return contiguous tracks numbered from 1, the last one without an end time
   * @throws EmptyTracklistException if there are no segments
   * @throws InvalidDurationException if the total duration is unusable
   * @throws TimestampFormatException if a segment timestamp cannot be parsed
   */
  public List<Track> reconcile(List<RawSegment> rawSegments, String totalDuration) {
    if (rawSegments == null || rawSegments.isEmpty()) {
      throw new EmptyTracklistException();
    }
    int total = parseTotal(totalDuration);

    List<Slot> slots = new ArrayList<>();
    int firstStart = Timestamps.toSeconds(rawSegments.get(0).startTime());
    if (firstStart != 0) {
      slots.add(Slot.unidentified(0, firstStart));
    }

    for (int i = 0; i < rawSegments.size(); i++) {
      RawSegment segment = rawSegments.get(i);
      int start = Timestamps.toSeconds(segment.startTime());
      int end = resolveEnd(rawSegments, i, total);

      if (!slots.isEmpty()) {
        Slot previous = slots.get(slots.size() - 1);
        int gap = start - previous.end;
        if (gap < 0) {
          LOGGER.warn(
              "Overlapping segments left as-is: '{}' ends at {}, '{}' starts at {}",
              previous.title,
              Timestamps.format(previous.end),
              segment.title(),
              Timestamps.format(start));
        } else if (gap > 0 && gap < GAP_THRESHOLD_SECONDS) {
          int midpoint = previous.end + gap / 2;
          LOGGER.debug("Bridging {}s gap at {}", gap, Timestamps.format(midpoint));
          previous.end = midpoint;
          start = midpoint;
        } else if (gap >= GAP_THRESHOLD_SECONDS) {
          LOGGER.debug(
              "Inserting ID track for {}s gap at {}", gap, Timestamps.format(previous.end));
          slots.add(Slot.unidentified(previous.end, start));
        }
      }

      slots.add(new Slot(artistOf(segment), titleOf(segment), start, end));
    }

    Slot last = slots.get(slots.size() - 1);
    int finalGap = total - last.end;
    if (finalGap < 0 || finalGap >= MAX_TRAILING_GAP_SECONDS) {
      throw new InvalidDurationException(
          String.format(
              "Invalid gap of %ds between last track end %s and total duration %s",
              finalGap, Timestamps.format(last.end), totalDuration));
    }
    if (finalGap >= GAP_THRESHOLD_SECONDS) {
      slots.add(Slot.unidentified(last.end, total));
    } else if (finalGap > 0) {
      last.end = total;
    }

    List<Track> tracks = new ArrayList<>(slots.size());
    for (int i = 0; i < slots.size(); i++) {
      Slot slot = slots.get(i);
      boolean isLast = i == slots.size() - 1;
      tracks.add(
          new Track(
              slot.artist,
              slot.title,
              Timestamps.format(slot.start),
              isLast ? "" : Timestamps.format(slot.end),
              i + 1));
    }

    LOGGER.info(
        "Reconciled {} segments into {} tracks (total duration {})",
        rawSegments.size(),
        tracks.size(),
        Timestamps.format(total));
    return List.copyOf(tracks);
  }

  private static int parseTotal(String totalDuration) {
    try {
      return Timestamps.toSeconds(totalDuration);
    } catch (TimestampFormatException e) {
      throw new InvalidDurationException("Invalid total duration: '" + totalDuration + "'", e);
    }
  }

  // A missing end runs up to the next segment, or to the end of the set for the last one.
  private static int resolveEnd(List<RawSegment> segments, int index, int total) {
    String end = segments.get(index).endTime();
    if (!Timestamps.isBlank(end)) {
      return Timestamps.toSeconds(end);
    }
    if (index + 1 < segments.size()) {
      return Timestamps.toSeconds(segments.get(index + 1).startTime());
    }
    return total;
  }

  private static String artistOf(RawSegment segment) {
    return isAnonymous(segment) ? Track.UNIDENTIFIED : segment.artist();
  }

  private static String titleOf(RawSegment segment) {
    return isAnonymous(segment) ? Track.UNIDENTIFIED : segment.title();
  }

  private static boolean isAnonymous(RawSegment segment) {
    return (segment.artist() == null || segment.artist().isBlank())
        && (segment.title() == null || segment.title().isBlank());
  }

  private static final class Slot {
    private final String artist;
    private final String title;
    private final int start;
    private int end;

    Slot(String artist, String title, int start, int end) {
      this.artist = artist;
      this.title = title;
      this.start = start;
      this.end = end;
    }

    static Slot unidentified(int start, int end) {
      return new Slot(Track.UNIDENTIFIED, Track.UNIDENTIFIED, start, end);
    }
  }
}
