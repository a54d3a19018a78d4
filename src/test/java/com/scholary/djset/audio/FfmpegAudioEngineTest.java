package com.scholary.djset.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.djset.tracklist.Track;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioEngineTest {

  private static final Track TRACK =
      new Track("Russell Haswell", "Heavy Handed Sunset", "00:02:16", "00:07:46", 2);

  @TempDir Path tempDir;

  private Path input;
  private FfmpegAudioEngine engine;

  @BeforeEach
  void setUp() throws IOException {
    input = Files.writeString(tempDir.resolve("mix.mp3"), "not really audio");
    engine = new FfmpegAudioEngine(properties("ffmpeg"));
  }

  @Test
  void extractArguments_shouldCutSegmentWithCodecForFormat() {
    Path temp = tempDir.resolve("out.part.mp3");

    List<String> args = engine.extractArguments(params(TRACK, "mp3", null), AudioFormat.MP3, temp);

    assertThat(args)
        .containsSubsequence("ffmpeg", "-y", "-i", input.toString())
        .containsSubsequence("-ss", "136", "-t", "330")
        .containsSubsequence("-c:a", "libmp3lame", "-f", "mp3", "-b:a", "128k")
        .containsSubsequence("-id3v2_version", "3");
    assertThat(args.get(args.size() - 1)).isEqualTo(temp.toString());
  }

  @Test
  void extractArguments_shouldRunToEndForLastTrack() {
    Track last = new Track("ID", "ID", "00:07:46", "", 3);

    List<String> args =
        engine.extractArguments(params(last, "flac", null), AudioFormat.FLAC, tempDir.resolve("t"));

    assertThat(args).contains("-ss", "466").doesNotContain("-t");
    assertThat(args).containsSubsequence("-c:a", "flac", "-f", "flac");
  }

  @Test
  void tagArguments_shouldEmbedCoverAndMetadata() throws IOException {
    Path cover = Files.writeString(tempDir.resolve("cover.jpg"), "jpeg");
    Path temp = tempDir.resolve("t.part.mp3");
    Path target = tempDir.resolve("t.mp3");

    List<String> args =
        engine.tagArguments(params(TRACK, "mp3", cover), AudioFormat.MP3, temp, target);

    assertThat(args)
        .containsSubsequence("-i", temp.toString(), "-i", cover.toString())
        .containsSubsequence("-map", "0:a", "-map", "1:v")
        .containsSubsequence("-disposition:v:0", "attached_pic")
        .contains(
            "album_artist=DJ Test",
            "artist=Russell Haswell",
            "title=Heavy Handed Sunset",
            "track=2/3",
            "album=Test Set",
            "compilation=1");
    assertThat(args.get(args.size() - 1)).isEqualTo(target.toString());
  }

  @Test
  void tagArguments_shouldSkipCoverForWav() throws IOException {
    Path cover = Files.writeString(tempDir.resolve("cover.jpg"), "jpeg");

    List<String> args =
        engine.tagArguments(
            params(TRACK, "wav", cover),
            AudioFormat.WAV,
            tempDir.resolve("a"),
            tempDir.resolve("b"));

    assertThat(args).doesNotContain(cover.toString(), "1:v", "attached_pic");
    assertThat(args).containsSubsequence("-c:a", "copy", "-f", "wav");
  }

  @Test
  void split_shouldRejectMissingInput() {
    SplitParams params =
        new SplitParams(
            tempDir.resolve("missing.mp3"),
            tempDir.resolve("out"),
            "mp3",
            TRACK,
            3,
            "DJ",
            "Set",
            null);

    assertThatThrownBy(() -> engine.split(params))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("does not exist");
  }

  @Test
  void split_shouldRejectEmptyInput() throws IOException {
    Path empty = Files.createFile(tempDir.resolve("empty.mp3"));
    SplitParams params =
        new SplitParams(empty, tempDir.resolve("out"), "mp3", TRACK, 3, "DJ", "Set", null);

    assertThatThrownBy(() -> engine.split(params))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void split_shouldRejectUnsupportedExtension() {
    assertThatThrownBy(() -> engine.split(params(TRACK, "ogg", null)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("ogg");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void split_shouldRunBothPassesAndReturnTarget() throws IOException {
    Path binary = script("fake-ffmpeg", "for last; do :; done", "echo data > \"$last\"");
    FfmpegAudioEngine scripted = new FfmpegAudioEngine(properties(binary.toString()));

    String result = scripted.split(params(TRACK, "mp3", null));

    Path target = tempDir.resolve("02 - Heavy Handed Sunset.mp3");
    assertThat(result).isEqualTo(target.toString());
    assertThat(target).exists();
    assertThat(tempDir.resolve("02 - Heavy Handed Sunset.part.mp3")).doesNotExist();
    assertThat(tempDir.resolve("02 - Heavy Handed Sunset.mp3.ffmpeg.log")).doesNotExist();
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void split_shouldIncludeFfmpegOutputInFailure() throws IOException {
    Path binary =
        script("failing-ffmpeg", "echo 'Invalid data found when processing input'", "exit 1");
    FfmpegAudioEngine scripted = new FfmpegAudioEngine(properties(binary.toString()));

    assertThatThrownBy(() -> scripted.split(params(TRACK, "mp3", null)))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exited with code 1")
        .hasMessageContaining("Invalid data found");
  }

  @Test
  void audioFormat_shouldResolveExtensionsCaseInsensitively() {
    assertThat(AudioFormat.fromExtension(".MP3")).contains(AudioFormat.MP3);
    assertThat(AudioFormat.fromExtension("m4a")).contains(AudioFormat.M4A);
    assertThat(AudioFormat.fromExtension("ogg")).isEmpty();
    assertThat(AudioFormat.fromExtension(null)).isEmpty();
  }

  private SplitParams params(Track track, String extension, Path cover) {
    return new SplitParams(
        input,
        tempDir.resolve(String.format("%02d - %s", track.trackNumber(), track.title())),
        extension,
        track,
        3,
        "DJ Test",
        "Test Set",
        cover);
  }

  private Path script(String name, String... lines) throws IOException {
    Path script = tempDir.resolve(name);
    Files.writeString(script, "#!/bin/sh\n" + String.join("\n", lines) + "\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }

  private static FfmpegProperties properties(String binary) {
    return new FfmpegProperties(binary, "128k", 3, Duration.ofSeconds(30));
  }
}
