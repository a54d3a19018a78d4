package com.scholary.djset.trackid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackIdSearchResponse(Result result) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(List<Audiostream> audiostreams, int rowCount) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Audiostream(String slug, String title) {}
}
