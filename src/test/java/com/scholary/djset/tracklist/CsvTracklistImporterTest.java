package com.scholary.djset.tracklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CsvTracklistImporterTest {

  private final CsvTracklistImporter importer = new CsvTracklistImporter(new TimingReconciler());

  @Test
  void importCsv_shouldReadMetadataAndTracks() {
    String csv =
        String.join(
            "\n",
            "duration,artist,name,id,start,end,track_artist,track_title,label",
            "00:30:00,DJ Test,Warehouse Set,1,00:00:00,00:10:00,Artist A,Opening,X",
            ",,,2,00:10:00,00:20:00,Artist B,\"Middle, Part 2\",Y",
            ",,,3,00:20:00,00:30:00,Artist C,Closing,Z");

    Tracklist tracklist = importer.importCsv(stream(csv));

    assertThat(tracklist.artist()).isEqualTo("DJ Test");
    assertThat(tracklist.name()).isEqualTo("Warehouse Set");
    assertThat(tracklist.tracks())
        .extracting(Track::title)
        .containsExactly("Opening", "Middle, Part 2", "Closing");
    assertThat(tracklist.tracks().get(2).endTime()).isEmpty();
  }

  @Test
  void importCsv_shouldFillGapsThroughReconciler() {
    String csv =
        String.join(
            "\n",
            "duration,artist,name,id,start,end,track_artist,track_title,label",
            "00:20:00,DJ Test,Set,1,00:01:00,00:05:00,Artist A,First,X",
            ",,,2,00:08:00,00:20:00,Artist B,Second,Y");

    Tracklist tracklist = importer.importCsv(stream(csv));

    assertThat(tracklist.tracks()).hasSize(4);
    assertThat(tracklist.tracks().get(0).isUnidentified()).isTrue();
    assertThat(tracklist.tracks().get(2)).isEqualTo(Track.unidentified("00:05:00", "00:08:00", 3));
  }

  @Test
  void importCsv_shouldRejectShortMetadataRow() {
    String csv = "header\n00:10:00,DJ,Set,1,00:00:00";

    assertThatThrownBy(() -> importer.importCsv(stream(csv)))
        .isInstanceOf(TracklistException.class)
        .hasMessageContaining("metadata row");
  }

  @Test
  void importCsv_shouldRejectMissingMetadataRow() {
    assertThatThrownBy(() -> importer.importCsv(stream("only,a,header")))
        .isInstanceOf(TracklistException.class);
  }

  private static InputStream stream(String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
  }
}
