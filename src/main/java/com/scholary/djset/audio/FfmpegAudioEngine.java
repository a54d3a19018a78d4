package com.scholary.djset.audio;

import com.scholary.djset.tracklist.Timestamps;
import com.scholary.djset.tracklist.Track;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Audio engine backed by the ffmpeg command line tool.
 *
 * <p>Each track is written in two passes. The first pass cuts and encodes the segment into a
 * temporary file. The second pass copies the audio stream and adds tags, plus the cover image for
 * formats that can carry one. ffmpeg output goes to a log file next to the target; its tail is
 * quoted in the exception when a pass fails.
 */
@Component
public class FfmpegAudioEngine implements AudioEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioEngine.class);

  private static final int LOG_TAIL_CHARS = 2000;

  private final FfmpegProperties properties;

  public FfmpegAudioEngine(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void extractCoverArt(Path input, Path output) throws IOException {
    validateInput(input);
    LOGGER.info("Extracting cover art: {} -> {}", input, output);

    List<String> command =
        List.of(
            properties.binary(),
            "-y",
            "-i",
            input.toString(),
            "-map",
            "0:v:0",
            "-c:v",
            "mjpeg",
            "-vframes",
            "1",
            output.toString());
    execute(command, logFileFor(output));

    if (!Files.exists(output) || Files.size(output) == 0) {
      throw new IOException("No cover art found in " + input);
    }
  }

  @Override
  public String split(SplitParams params) throws IOException {
    validateInput(params.inputPath());
    AudioFormat format =
        AudioFormat.fromExtension(params.fileExtension())
            .orElseThrow(
                () -> new IOException("Unsupported file extension: " + params.fileExtension()));

    Path target = Path.of(params.outputPath() + "." + format.extension());
    Path temp = Path.of(params.outputPath() + ".part." + format.extension());
    Path logFile = logFileFor(target);
    Track track = params.track();

    LOGGER.info(
        "Cutting track {}: {}-{} to {}",
        track.trackNumber(),
        track.startTime(),
        track.hasEndTime() ? track.endTime() : "end",
        target);

    try {
      execute(extractArguments(params, format, temp), logFile);
      execute(tagArguments(params, format, temp, target), logFile);
    } finally {
      Files.deleteIfExists(temp);
    }
    Files.deleteIfExists(logFile);
    return target.toString();
  }

  /** First pass: cut the segment and encode it. */
  List<String> extractArguments(SplitParams params, AudioFormat format, Path temp) {
    Track track = params.track();
    int start = Timestamps.toSeconds(track.startTime());

    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.add("-y");
    command.add("-i");
    command.add(params.inputPath().toString());
    command.add("-ss");
    command.add(String.valueOf(start));
    if (track.hasEndTime()) {
      int duration = Timestamps.toSeconds(track.endTime()) - start;
      command.add("-t");
      command.add(String.valueOf(Math.max(duration, 0)));
    }
    command.addAll(
        List.of(
            "-map",
            "0:a",
            "-c:a",
            format.codec(),
            "-f",
            format.muxer(),
            "-b:a",
            properties.audioBitrate(),
            "-af",
            "aresample=async=1",
            "-movflags",
            "+faststart",
            "-id3v2_version",
            String.valueOf(properties.id3Version()),
            temp.toString()));
    return command;
  }

  /** Second pass: copy the audio and write tags and cover art. */
  List<String> tagArguments(SplitParams params, AudioFormat format, Path temp, Path target) {
    boolean withCover =
        params.coverArtPath() != null
            && format.supportsCoverArt()
            && Files.exists(params.coverArtPath());
    Track track = params.track();

    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.add("-y");
    command.add("-i");
    command.add(temp.toString());
    if (withCover) {
      command.add("-i");
      command.add(params.coverArtPath().toString());
    }
    command.add("-map");
    command.add("0:a");
    if (withCover) {
      command.add("-map");
      command.add("1:v");
    }
    command.add("-c:a");
    command.add("copy");
    if (withCover) {
      command.addAll(
          List.of(
              "-c:v",
              "mjpeg",
              "-disposition:v:0",
              "attached_pic",
              "-metadata:s:v",
              "title=Album cover",
              "-metadata:s:v",
              "comment=Cover (front)"));
    }
    command.addAll(
        List.of(
            "-f",
            format.muxer(),
            "-metadata",
            "album_artist=" + nullToEmpty(params.artist()),
            "-metadata",
            "artist=" + nullToEmpty(track.artist()),
            "-metadata",
            "title=" + nullToEmpty(track.title()),
            "-metadata",
            "track=" + track.trackNumber() + "/" + params.trackCount(),
            "-metadata",
            "album=" + nullToEmpty(params.name()),
            "-metadata",
            "compilation=1",
            "-id3v2_version",
            String.valueOf(properties.id3Version()),
            target.toString()));
    return command;
  }

  private void execute(List<String> command, Path logFile) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process =
        new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(logFile.toFile())
            .start();

    try {
      boolean finished =
          process.waitFor(properties.processTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new IOException(
            "ffmpeg did not finish within " + properties.processTimeout() + ": " + tail(logFile));
      }
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new IOException("ffmpeg exited with code " + exitCode + ": " + tail(logFile));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException("ffmpeg interrupted", e);
    }
  }

  private static void validateInput(Path input) throws IOException {
    if (!Files.exists(input)) {
      throw new IOException("Input file does not exist: " + input);
    }
    if (Files.isDirectory(input)) {
      throw new IOException("Input path is a directory: " + input);
    }
    if (Files.size(input) == 0) {
      throw new IOException("Input file is empty: " + input);
    }
  }

  private static Path logFileFor(Path target) {
    return Path.of(target + ".ffmpeg.log");
  }

  private static String tail(Path logFile) {
    try {
      String log = Files.readString(logFile, StandardCharsets.UTF_8).strip();
      return log.length() <= LOG_TAIL_CHARS ? log : log.substring(log.length() - LOG_TAIL_CHARS);
    } catch (IOException e) {
      LOGGER.warn("Could not read ffmpeg log {}", logFile, e);
      return "<no log available>";
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
