package com.scholary.djset.tracklist;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One track of a DJ set.
 *
 * <p>Timestamps are kept as strings ({@code HH:MM:SS}, {@code H:MM:SS} or {@code MM:SS}); see
 * {@link Timestamps} for conversion. {@code endTime} is empty only for the last track of a
 * reconciled tracklist. The download fields are only set on copies handed to API callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Track(
    String artist,
    String title,
    String startTime,
    String endTime,
    int trackNumber,
    String downloadUrl,
    Long sizeBytes,
    Boolean available) {

  /** Artist and title used for stretches of audio nobody identified. */
  public static final String UNIDENTIFIED = "ID";

  public Track(String artist, String title, String startTime, String endTime, int trackNumber) {
    this(artist, title, startTime, endTime, trackNumber, null, null, null);
  }

  public static Track unidentified(String startTime, String endTime, int trackNumber) {
    return new Track(UNIDENTIFIED, UNIDENTIFIED, startTime, endTime, trackNumber);
  }

  @JsonIgnore
  public boolean isUnidentified() {
    return UNIDENTIFIED.equals(artist) && UNIDENTIFIED.equals(title);
  }

  @JsonIgnore
  public boolean hasEndTime() {
    return endTime != null && !endTime.isBlank();
  }

  public Track withTrackNumber(int number) {
    return new Track(artist, title, startTime, endTime, number, downloadUrl, sizeBytes, available);
  }

  public Track withDownload(String url, long size, boolean isAvailable) {
    return new Track(artist, title, startTime, endTime, trackNumber, url, size, isAvailable);
  }
}
