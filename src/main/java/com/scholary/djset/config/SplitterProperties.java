package com.scholary.djset.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for job processing, bound from {@code splitter.*}.
 *
 * @param outputDir root directory for split tracks
 * @param tempDir scratch space for downloads, one subdirectory per job
 * @param jobTimeout deadline for a whole job, download included
 * @param maxTracks largest tracklist accepted per job
 */
@ConfigurationProperties(prefix = "splitter")
@Validated
public record SplitterProperties(
    @NotBlank String outputDir,
    @NotBlank String tempDir,
    @NotBlank String defaultFileExtension,
    @NotNull Duration jobTimeout,
    @Positive int maxTracks,
    @Positive int jobExecutorThreads,
    @Positive int jobExecutorQueueSize,
    @Positive int splitExecutorThreads) {}
