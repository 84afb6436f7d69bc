package com.scholary.djset.service;

/** Thrown when a completed job has no such track, or the track's file is gone. */
public class ArtifactNotFoundException extends RuntimeException {

  public ArtifactNotFoundException(String message) {
    super(message);
  }
}
