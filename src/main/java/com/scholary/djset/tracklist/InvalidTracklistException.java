package com.scholary.djset.tracklist;

import com.scholary.djset.job.InvalidRequestException;

/** Thrown when a submitted tracklist cannot be parsed into at least one valid track. */
public class InvalidTracklistException extends InvalidRequestException {

  public InvalidTracklistException(String message) {
    super("invalid tracklist: " + message);
  }

  public InvalidTracklistException(String message, Throwable cause) {
    super("invalid tracklist: " + message, cause);
  }
}
