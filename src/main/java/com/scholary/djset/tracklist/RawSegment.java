package com.scholary.djset.tracklist;

/**
 * Unverified timing for one song, as scraped or imported. {@code endTime} may be null or blank.
 */
public record RawSegment(String artist, String title, String startTime, String endTime) {}
