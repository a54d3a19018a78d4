package com.scholary.djset.api;

import com.scholary.djset.tracklist.Tracklist;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to download and split a set.
 *
 * @param url http(s) location of the mix
 * @param fileExtension one of mp3, m4a, wav, flac; defaults to mp3
 * @param maxConcurrentTasks tracks split at once, 1 to 10; defaults to 4
 */
public record ProcessRequest(
    @NotBlank String url,
    @NotNull @Valid Tracklist tracklist,
    @Schema(example = "mp3") String fileExtension,
    @Schema(example = "4") Integer maxConcurrentTasks) {}
