package com.scholary.djset.split;

import com.scholary.djset.tracklist.Tracklist;
import java.nio.file.Path;

/**
 * Input of one {@link SplitPipeline} run.
 *
 * @param outputDir root under which the set directory is created
 * @param concurrencyLimit maximum tracks cut at once; out-of-range values fall back to the default
 */
public record SplitRequest(
    Tracklist tracklist,
    Path sourceFile,
    Path outputDir,
    String fileExtension,
    int concurrencyLimit) {}
