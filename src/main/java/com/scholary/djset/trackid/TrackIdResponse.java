package com.scholary.djset.trackid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Detection result for one audiostream. Only the fields the importer reads are mapped. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackIdResponse(Result result) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(
      String title,
      String duration,
      @JsonProperty("detectionProcesses") List<DetectionProcess> detectionProcesses) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DetectionProcess(
      @JsonProperty("detectionProcessMusicTracks") List<DetectedTrack> tracks) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DetectedTrack(String artist, String title, String startTime, String endTime) {}
}
