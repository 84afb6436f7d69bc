package com.scholary.djset.tracklist;

/**
 * One entry of a tracklist.
 *
 * <p>Start and end are the human-readable offsets into the set ({@code MM:SS} or {@code
 * H:MM:SS}). {@code endTime} may be null for the last track, meaning "until the end of the set".
 */
public record Track(
    String artist, String name, String startTime, String endTime, int trackNumber) {}
