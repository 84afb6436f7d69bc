package com.scholary.djset.progress;

/**
 * Track-level detail attached to a progress event while tracks are being cut.
 *
 * @param currentTrack name of the track the event refers to
 * @param trackNumber 1-based position of that track in the tracklist
 * @param processedTracks number of tracks finished so far, including this one
 * @param totalTracks number of tracks in the tracklist
 */
public record TrackDetails(
    String currentTrack, int trackNumber, int processedTracks, int totalTracks) {}
