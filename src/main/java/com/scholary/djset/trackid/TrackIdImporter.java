package com.scholary.djset.trackid;

import com.scholary.djset.tracklist.RawSegment;
import com.scholary.djset.tracklist.TimingReconciler;
import com.scholary.djset.tracklist.Tracklist;
import com.scholary.djset.tracklist.TracklistException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds tracklists from TrackID recognition results.
 *
 * <p>Detections of every process are taken in order as raw segments, the audiostream duration is
 * the total, and the {@link TimingReconciler} fills the gaps. The set is named after the
 * audiostream title; the artist is guessed from it.
 */
@Component
public class TrackIdImporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackIdImporter.class);

  private static final List<String> ARTIST_SEPARATORS =
      List.of(" - ", " | ", " @ ", " live at ", " presents ", " b2b ");

  private final TrackIdService trackIdService;
  private final TimingReconciler reconciler;

  public TrackIdImporter(TrackIdService trackIdService, TimingReconciler reconciler) {
    this.trackIdService = trackIdService;
    this.reconciler = reconciler;
  }

  /**
   * Search TrackID and import the best match.
   *
   * @throws TracklistException if nothing matches or the detections cannot be reconciled
   * @throws TrackIdException if the API call fails
   */
  public Tracklist importSet(String keywords) {
    String slug =
        trackIdService
            .findSlug(keywords)
            .orElseThrow(
                () -> new TracklistException("No TrackID audiostream matches '" + keywords + "'"));
    return toTracklist(trackIdService.fetchDetections(slug));
  }

  /**
   * Reconcile one detection result.
   *
   * @throws TracklistException if there are no detections or the timings are unusable
   */
  public Tracklist toTracklist(TrackIdResponse response) {
    TrackIdResponse.Result result = response == null ? null : response.result();
    if (result == null) {
      throw new TracklistException("TrackID response has no result");
    }

    List<RawSegment> segments = new ArrayList<>();
    if (result.detectionProcesses() != null) {
      for (TrackIdResponse.DetectionProcess process : result.detectionProcesses()) {
        if (process.tracks() == null) {
          continue;
        }
        for (TrackIdResponse.DetectedTrack track : process.tracks()) {
          segments.add(
              new RawSegment(track.artist(), track.title(), track.startTime(), track.endTime()));
        }
      }
    }

    String name = result.title();
    String artist = inferArtist(name);
    LOGGER.info(
        "Imported {} detections from TrackID: name={}, artist={}, duration={}",
        segments.size(),
        name,
        artist,
        result.duration());
    return reconciler.reconcile(name, artist, segments, result.duration());
  }

  /**
   * Guess the DJ from a set title such as {@code "Carl Cox | Tomorrowland 2022"}.
   *
   * <p>Radio shows lose everything from {@code Episode} or {@code Live} on. Otherwise the text
   * before the first known separator wins. Titles starting with {@code "The "} and single words
   * give an empty artist.
   */
  static String inferArtist(String title) {
    if (title == null || title.isBlank() || title.startsWith("The ")) {
      return "";
    }
    if (title.trim().split("\\s+").length <= 1) {
      return "";
    }

    for (String marker : List.of("Episode", "Live")) {
      int index = title.indexOf(marker);
      if (index >= 0) {
        return title.substring(0, index).trim();
      }
    }

    String lower = title.toLowerCase(Locale.ROOT);
    for (String separator : ARTIST_SEPARATORS) {
      int index = lower.indexOf(separator);
      if (index > 0) {
        return title.substring(0, index).trim();
      }
    }
    return "";
  }
}
