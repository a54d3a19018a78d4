package com.scholary.djset.split;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.djset.tracklist.Track;
import com.scholary.djset.tracklist.Tracklist;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class FileNamesTest {

  @Test
  void sanitize_shouldReplaceUnsafeCharacters() {
    assertThat(FileNames.sanitize("AC/DC: Live? <\"Best\"> | *"))
        .isEqualTo("AC_DC_ Live_ __Best__ _ _");
    assertThat(FileNames.sanitize("back\\slash")).isEqualTo("back_slash");
    assertThat(FileNames.sanitize("tab\there\nnewline")).isEqualTo("tab_here_newline");
  }

  @Test
  void sanitize_shouldNeutralizeParentReferences() {
    assertThat(FileNames.sanitize("../../etc/passwd")).doesNotContain("..").doesNotContain("/");
  }

  @Test
  void sanitize_shouldTrimSpacesAndDots() {
    assertThat(FileNames.sanitize("  . Title . ")).isEqualTo("Title");
  }

  @Test
  void sanitize_shouldFallBackToUntitled() {
    assertThat(FileNames.sanitize(" . ")).isEqualTo("untitled");
    assertThat(FileNames.sanitize(null)).isEqualTo("untitled");
  }

  @Test
  void trackFileName_shouldPadTrackNumber() {
    Track track = new Track("Russell Haswell", "Heavy Handed Sunset", "00:02:16", "", 3);

    assertThat(FileNames.trackFileName(track)).isEqualTo("03 - Heavy Handed Sunset");
  }

  @Test
  void setDirectory_shouldCombineArtistAndName() {
    Path root = Path.of("/data/out");

    assertThat(FileNames.setDirectory(root, new Tracklist("Live", "DJ", List.of())))
        .isEqualTo(root.resolve("DJ - Live"));
    assertThat(FileNames.setDirectory(root, new Tracklist("Live", " ", List.of())))
        .isEqualTo(root.resolve("Live"));
  }
}
