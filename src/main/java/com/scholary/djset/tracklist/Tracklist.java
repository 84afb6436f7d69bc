package com.scholary.djset.tracklist;

import java.util.List;

/**
 * A parsed tracklist: set metadata plus the ordered tracks used to cut the audio.
 *
 * <p>Set-level fields are optional for plain-text tracklists.
 */
public record Tracklist(
    String name, String artist, String genre, Integer year, List<Track> tracks) {

  public Tracklist {
    tracks = List.copyOf(tracks);
  }

  public int size() {
    return tracks.size();
  }
}
