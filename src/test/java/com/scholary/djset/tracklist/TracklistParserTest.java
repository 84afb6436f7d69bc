package com.scholary.djset.tracklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.djset.config.JobProperties;
import com.scholary.djset.job.InvalidRequestException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TracklistParserTest {

  private TracklistParser parser;

  @BeforeEach
  void setUp() {
    JobProperties properties =
        new JobProperties(
            4,
            4,
            10,
            100,
            3,
            Duration.ofSeconds(10),
            Duration.ofMinutes(45),
            Duration.ofHours(24),
            "mp3");
    parser = new TracklistParser(new ObjectMapper(), properties);
  }

  @Test
  void parse_shouldReadNumberedTextLines() {
    Tracklist tracklist = parser.parse("1. A - X 00:00-03:30\n2. B - Y 03:30-07:00");

    assertThat(tracklist.size()).isEqualTo(2);
    Track first = tracklist.tracks().get(0);
    assertThat(first.artist()).isEqualTo("A");
    assertThat(first.name()).isEqualTo("X");
    assertThat(first.startTime()).isEqualTo("00:00");
    assertThat(first.endTime()).isEqualTo("03:30");
    assertThat(first.trackNumber()).isEqualTo(1);
    assertThat(tracklist.tracks().get(1).trackNumber()).isEqualTo(2);
  }

  @Test
  void parse_shouldFillMissingEndFromNextStart() {
    Tracklist tracklist =
        parser.parse("# warmup\n\nArtist One - First Song 0:00\nArtist Two - Second - Edit 4:10\n");

    assertThat(tracklist.tracks().get(0).endTime()).isEqualTo("4:10");
    assertThat(tracklist.tracks().get(1).name()).isEqualTo("Second - Edit");
    assertThat(tracklist.tracks().get(1).endTime()).isNull();
  }

  @Test
  void parse_shouldReadJsonDocument() {
    String json =
        """
        {"name": "Live at Club", "artist": "DJ Test", "genre": "House", "year": 2023,
         "tracks": [
           {"name": "Opener", "artist": "A", "start_time": "00:00", "end_time": "05:00"},
           {"name": "Closer", "artist": "B", "start_time": "05:00"}
         ],
         "unknown": true}
        """;

    Tracklist tracklist = parser.parse(json);

    assertThat(tracklist.name()).isEqualTo("Live at Club");
    assertThat(tracklist.artist()).isEqualTo("DJ Test");
    assertThat(tracklist.year()).isEqualTo(2023);
    assertThat(tracklist.tracks()).extracting(Track::name).containsExactly("Opener", "Closer");
    assertThat(tracklist.tracks().get(1).endTime()).isNull();
  }

  @Test
  void parse_shouldRequireSetNameAndArtistInJson() {
    assertThatThrownBy(
            () -> parser.parse("{\"tracks\": [{\"name\": \"X\", \"start_time\": \"00:00\"}]}"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("artist and name are required");
  }

  @Test
  void parse_shouldRejectMalformedJson() {
    assertThatThrownBy(() -> parser.parse("{\"name\": "))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageStartingWith("invalid tracklist: ");
  }

  @Test
  void parse_shouldRejectLineWithoutOffset() {
    assertThatThrownBy(() -> parser.parse("A - X 00:00\nno offset here"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void parse_shouldRejectTrackEndingBeforeItStarts() {
    assertThatThrownBy(() -> parser.parse("A - X 05:00-03:00"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("ends before it starts");
  }

  @Test
  void parse_shouldRejectOutOfRangeStartOnOpenEndedLastTrack() {
    assertThatThrownBy(() -> parser.parse("1. A - X 00:00-03:30\n2. B - Y 03:75"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("track 2")
        .hasMessageContaining("03:75");
  }

  @Test
  void parse_shouldRejectEmptyTracklist() {
    assertThatThrownBy(() -> parser.parse("# only a comment"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("at least one track");
    assertThatThrownBy(() -> parser.parse("  "))
        .isInstanceOf(InvalidTracklistException.class);
  }

  @Test
  void parse_shouldEnforceTrackLimit() {
    assertThatThrownBy(() -> parser.parse("A - 1 0:00\nB - 2 1:00\nC - 3 2:00\nD - 4 3:00"))
        .isInstanceOf(InvalidTracklistException.class)
        .hasMessageContaining("maximum 3 tracks");
  }
}
