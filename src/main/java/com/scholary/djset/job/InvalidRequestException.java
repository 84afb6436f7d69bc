package com.scholary.djset.job;

/**
 * Thrown when a request is rejected before it reaches the job state machine: missing submission
 * fields, an unsupported option, or invalid paging.
 */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }

  public InvalidRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
