package com.scholary.djset.audio;

import com.scholary.djset.tracklist.Track;
import java.nio.file.Path;

/**
 * Everything the engine needs to cut one track.
 *
 * @param inputPath the downloaded mix
 * @param outputPath target path without extension
 * @param fileExtension output format, see {@link AudioFormat}
 * @param track the track to cut
 * @param trackCount number of tracks in the set, for the {@code track} tag
 * @param artist artist of the whole set, written as album artist
 * @param name name of the set, written as album
 * @param coverArtPath cover image to embed, or null
 */
public record SplitParams(
    Path inputPath,
    Path outputPath,
    String fileExtension,
    Track track,
    int trackCount,
    String artist,
    String name,
    Path coverArtPath) {}
