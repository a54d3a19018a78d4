package com.scholary.djset.tracklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimestampsTest {

  @Test
  void toSeconds_shouldParseSupportedForms() {
    assertThat(Timestamps.toSeconds("01:02:03")).isEqualTo(3723);
    assertThat(Timestamps.toSeconds("1:02:03")).isEqualTo(3723);
    assertThat(Timestamps.toSeconds("59:30")).isEqualTo(3570);
    assertThat(Timestamps.toSeconds(" 00:00 ")).isZero();
  }

  @Test
  void toSeconds_shouldDropFractionalSeconds() {
    assertThat(Timestamps.toSeconds("00:02:16.750")).isEqualTo(136);
  }

  @Test
  void toSeconds_shouldRejectMalformedValues() {
    assertThatThrownBy(() -> Timestamps.toSeconds("abc"))
        .isInstanceOf(TimestampFormatException.class);
    assertThatThrownBy(() -> Timestamps.toSeconds("10"))
        .isInstanceOf(TimestampFormatException.class);
    assertThatThrownBy(() -> Timestamps.toSeconds("00:61"))
        .isInstanceOf(TimestampFormatException.class);
    assertThatThrownBy(() -> Timestamps.toSeconds(""))
        .isInstanceOf(TimestampFormatException.class);
  }

  @Test
  void format_shouldPadToHoursMinutesSeconds() {
    assertThat(Timestamps.format(0)).isEqualTo("00:00:00");
    assertThat(Timestamps.format(136)).isEqualTo("00:02:16");
    assertThat(Timestamps.format(36_000)).isEqualTo("10:00:00");
  }

  @Test
  void format_shouldRejectNegativeSeconds() {
    assertThatThrownBy(() -> Timestamps.format(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }
}
