package com.scholary.djset.progress;

/** Per-track detail attached to processing events. */
public record TrackDetails(
    int trackNumber, int totalTracks, String currentTrack, int processedTracks) {}
