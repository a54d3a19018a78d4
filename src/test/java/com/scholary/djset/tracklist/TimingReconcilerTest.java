package com.scholary.djset.tracklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimingReconcilerTest {

  private final TimingReconciler reconciler = new TimingReconciler();

  @Test
  void reconcile_shouldBridgeGapOfFiftyNineSeconds() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("A", "One", "00:00", "01:00"),
                new RawSegment("B", "Two", "01:59", "03:00")),
            "03:00");

    assertThat(tracks).hasSize(2);
    assertThat(tracks).noneMatch(Track::isUnidentified);
    assertThat(tracks.get(0).endTime()).isEqualTo("00:01:29");
    assertThat(tracks.get(1).startTime()).isEqualTo("00:01:29");
  }

  @Test
  void reconcile_shouldInsertIdTrackForGapOfSixtySeconds() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("A", "One", "00:00", "01:00"),
                new RawSegment("B", "Two", "02:00", "03:00")),
            "03:00");

    assertThat(tracks).hasSize(3);
    assertThat(tracks.get(1))
        .isEqualTo(Track.unidentified("00:01:00", "00:02:00", 2));
    assertThat(tracks.get(2).artist()).isEqualTo("B");
    assertThat(tracks.get(2).trackNumber()).isEqualTo(3);
  }

  @Test
  void reconcile_shouldInsertLeadingIdTrack() {
    List<Track> tracks =
        reconciler.reconcile(List.of(new RawSegment("A", "One", "00:30", "05:00")), "05:00");

    assertThat(tracks).hasSize(2);
    assertThat(tracks.get(0)).isEqualTo(Track.unidentified("00:00:00", "00:00:30", 1));
    assertThat(tracks.get(1).startTime()).isEqualTo("00:00:30");
  }

  @Test
  void reconcile_shouldMatchHandwrittenSetExample() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("", "", "00:00", "00:02:16"),
                new RawSegment("Russell Haswell", "Heavy Handed Sunset", "02:16", "07:46")),
            "59:30");

    assertThat(tracks)
        .containsExactly(
            new Track("ID", "ID", "00:00:00", "00:02:16", 1),
            new Track("Russell Haswell", "Heavy Handed Sunset", "00:02:16", "00:07:46", 2),
            new Track("ID", "ID", "00:07:46", "", 3));
  }

  @Test
  void reconcile_shouldExtendLastTrackForShortTrailingGap() {
    List<Track> tracks =
        reconciler.reconcile(List.of(new RawSegment("A", "One", "00:00", "04:30")), "05:00");

    assertThat(tracks).hasSize(1);
    assertThat(tracks.get(0).endTime()).isEmpty();
  }

  @Test
  void reconcile_shouldAppendTrailingIdTrackForLongGap() {
    List<Track> tracks =
        reconciler.reconcile(List.of(new RawSegment("A", "One", "00:00", "04:00")), "05:00");

    assertThat(tracks).hasSize(2);
    assertThat(tracks.get(0).endTime()).isEqualTo("00:04:00");
    assertThat(tracks.get(1)).isEqualTo(Track.unidentified("00:04:00", "", 2));
  }

  @Test
  void reconcile_shouldTreatMissingEndAsNextStart() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("A", "One", "00:00", null),
                new RawSegment("B", "Two", "03:00", "")),
            "06:00");

    assertThat(tracks).hasSize(2);
    assertThat(tracks.get(0).endTime()).isEqualTo("00:03:00");
    assertThat(tracks.get(1).endTime()).isEmpty();
  }

  @Test
  void reconcile_shouldLeaveOverlapsUntouched() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("A", "One", "00:00", "03:10"),
                new RawSegment("B", "Two", "03:00", "06:00")),
            "06:00");

    assertThat(tracks).hasSize(2);
    assertThat(tracks.get(0).endTime()).isEqualTo("00:03:10");
    assertThat(tracks.get(1).startTime()).isEqualTo("00:03:00");
  }

  @Test
  void reconcile_shouldBeIdempotentOnContiguousInput() {
    List<RawSegment> contiguous =
        List.of(
            new RawSegment("A", "One", "00:00:00", "00:03:00"),
            new RawSegment("B", "Two", "00:03:00", "00:07:30"),
            new RawSegment("C", "Three", "00:07:30", "00:12:00"));

    List<Track> first = reconciler.reconcile(contiguous, "00:12:00");
    List<Track> second = reconciler.reconcile(toSegments(first), "00:12:00");

    assertThat(second).isEqualTo(first);
    assertThat(first)
        .extracting(Track::startTime)
        .containsExactly("00:00:00", "00:03:00", "00:07:30");
  }

  @Test
  void reconcile_shouldCoverWholeSetWithoutHoles() {
    List<Track> tracks =
        reconciler.reconcile(
            List.of(
                new RawSegment("A", "One", "01:00", "04:00"),
                new RawSegment("B", "Two", "04:20", "09:00"),
                new RawSegment("C", "Three", "15:00", "20:00"),
                new RawSegment("D", "Four", "20:00", "")),
            "1:00:00");

    assertThat(tracks.get(0).startTime()).isEqualTo("00:00:00");
    for (int i = 0; i + 1 < tracks.size(); i++) {
      assertThat(tracks.get(i).endTime()).isEqualTo(tracks.get(i + 1).startTime());
      assertThat(tracks.get(i).trackNumber()).isEqualTo(i + 1);
    }
    assertThat(tracks.get(tracks.size() - 1).endTime()).isEmpty();
  }

  @Test
  void reconcile_shouldRejectEmptyInput() {
    assertThatThrownBy(() -> reconciler.reconcile(List.of(), "10:00"))
        .isInstanceOf(EmptyTracklistException.class);
  }

  @Test
  void reconcile_shouldRejectTotalBeforeLastEnd() {
    assertThatThrownBy(
            () ->
                reconciler.reconcile(
                    List.of(new RawSegment("A", "One", "00:00", "10:00")), "05:00"))
        .isInstanceOf(InvalidDurationException.class);
  }

  @Test
  void reconcile_shouldRejectTrailingGapOfADayOrMore() {
    assertThatThrownBy(
            () ->
                reconciler.reconcile(
                    List.of(new RawSegment("A", "One", "00:00", "10:00")), "24:10:00"))
        .isInstanceOf(InvalidDurationException.class);
  }

  @Test
  void reconcile_shouldRejectUnparseableTotal() {
    assertThatThrownBy(
            () ->
                reconciler.reconcile(
                    List.of(new RawSegment("A", "One", "00:00", "10:00")), "soon"))
        .isInstanceOf(InvalidDurationException.class)
        .hasMessageContaining("soon");
  }

  @Test
  void reconcile_shouldKeepSetNameAndArtist() {
    Tracklist tracklist =
        reconciler.reconcile(
            "Boiler Room", "Someone", List.of(new RawSegment("A", "One", "00:00", "")), "05:00");

    assertThat(tracklist.name()).isEqualTo("Boiler Room");
    assertThat(tracklist.artist()).isEqualTo("Someone");
    assertThat(tracklist.tracks()).hasSize(1);
  }

  private static List<RawSegment> toSegments(List<Track> tracks) {
    List<RawSegment> segments = new ArrayList<>();
    for (Track track : tracks) {
      segments.add(
          new RawSegment(track.artist(), track.title(), track.startTime(), track.endTime()));
    }
    return segments;
  }
}
