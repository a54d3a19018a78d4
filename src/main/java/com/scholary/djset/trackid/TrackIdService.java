package com.scholary.djset.trackid;

import java.util.Optional;

/** Lookup of recognised tracks for a published mix. */
public interface TrackIdService {

  /**
   * Find the best matching audiostream.
   *
   * @return its slug, or empty when nothing matches
   * @throws TrackIdException if the API call fails
   */
  Optional<String> findSlug(String keywords);

  /**
   * Fetch the detections of one audiostream.
   *
   * @throws TrackIdException if the API call fails
   */
  TrackIdResponse fetchDetections(String slug);
}
