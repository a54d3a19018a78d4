package com.scholary.djset.tracklist;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/** A named DJ set and its ordered tracks. */
public record Tracklist(@NotBlank String name, String artist, @NotEmpty List<Track> tracks) {

  public Tracklist {
    tracks = tracks == null ? List.of() : List.copyOf(tracks);
  }

  public Tracklist withTracks(List<Track> replacement) {
    return new Tracklist(name, artist, replacement);
  }

  /** Copy whose track numbers are the 1-based positions of the tracks. */
  public Tracklist renumbered() {
    List<Track> numbered = new ArrayList<>(tracks.size());
    for (int i = 0; i < tracks.size(); i++) {
      numbered.add(tracks.get(i).withTrackNumber(i + 1));
    }
    return withTracks(numbered);
  }
}
