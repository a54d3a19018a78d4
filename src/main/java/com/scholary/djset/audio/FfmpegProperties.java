package com.scholary.djset.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Settings for the ffmpeg binary, bound from {@code ffmpeg.*}. */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @NotBlank String audioBitrate,
    @Positive int id3Version,
    @NotNull Duration processTimeout) {}
