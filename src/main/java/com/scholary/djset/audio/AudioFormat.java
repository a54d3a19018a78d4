package com.scholary.djset.audio;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Output formats the splitter can produce, with their ffmpeg codec and muxer. */
public enum AudioFormat {
  MP3("mp3", "libmp3lame", "mp3", true),
  M4A("m4a", "aac", "mp4", true),
  WAV("wav", "pcm_s16le", "wav", false),
  FLAC("flac", "flac", "flac", true);

  private final String extension;
  private final String codec;
  private final String muxer;
  private final boolean supportsCoverArt;

  AudioFormat(String extension, String codec, String muxer, boolean supportsCoverArt) {
    this.extension = extension;
    this.codec = codec;
    this.muxer = muxer;
    this.supportsCoverArt = supportsCoverArt;
  }

  public static Optional<AudioFormat> fromExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    String normalized = extension.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    String wanted = normalized;
    return Arrays.stream(values()).filter(f -> f.extension.equals(wanted)).findFirst();
  }

  public String extension() {
    return extension;
  }

  public String codec() {
    return codec;
  }

  public String muxer() {
    return muxer;
  }

  public boolean supportsCoverArt() {
    return supportsCoverArt;
  }
}
