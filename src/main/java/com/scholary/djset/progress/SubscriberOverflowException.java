package com.scholary.djset.progress;

/**
 * Thrown to a progress subscriber that fell too far behind and was disconnected.
 *
 * <p>Only the slow subscriber sees this. The producer and other subscribers are unaffected.
 */
public class SubscriberOverflowException extends RuntimeException {

  public SubscriberOverflowException(String jobId, int capacity) {
    super(
        String.format(
            "Subscriber for job %s fell behind by more than %d events and was disconnected",
            jobId, capacity));
  }
}
