package com.scholary.djset.progress;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A live view of one job's progress events, starting from the moment it was created.
 *
 * <p>The producer side ({@link ProgressBus}) offers events into a bounded buffer and never blocks.
 * The consumer drains it with {@link #poll(Duration)}. The stream finishes after the terminal
 * event has been delivered, after {@link #close()}, or after the subscriber overflowed, in which
 * case the buffered events are delivered first and then {@link SubscriberOverflowException} is
 * thrown once.
 *
 * <p>Intended for a single consuming thread.
 */
public class ProgressSubscription implements AutoCloseable {

  private final String jobId;
  private final int capacity;
  private final BlockingQueue<ProgressEvent> buffer;
  private final Consumer<ProgressSubscription> onClose;

  private volatile boolean overflowed;
  private volatile boolean closed;
  private volatile boolean finished;

  ProgressSubscription(String jobId, int capacity, Consumer<ProgressSubscription> onClose) {
    this.jobId = jobId;
    this.capacity = capacity;
    this.buffer = new ArrayBlockingQueue<>(capacity);
    this.onClose = onClose;
  }

  /**
   * Hand an event to this subscriber. Called by the bus while it holds the job's channel lock.
   *
   * @return false if the buffer is full; the subscriber is then marked overflowed
   */
  boolean offer(ProgressEvent event) {
    if (closed) {
      return false;
    }
    if (!buffer.offer(event)) {
      overflowed = true;
      return false;
    }
    return true;
  }

  /**
   * Wait up to {@code timeout} for the next event.
   *
   * @return the next event, or empty on timeout or once the stream is finished
   * @throws SubscriberOverflowException if this subscriber was disconnected for falling behind
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
    if (finished) {
      return Optional.empty();
    }

    ProgressEvent event = buffer.poll();
    if (event == null) {
      if (overflowed) {
        finished = true;
        throw new SubscriberOverflowException(jobId, capacity);
      }
      if (closed) {
        finished = true;
        return Optional.empty();
      }
      event = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (event == null) {
        return Optional.empty();
      }
    }

    if (event.isTerminal()) {
      finished = true;
    }
    return Optional.of(event);
  }

  public boolean isFinished() {
    return finished;
  }

  public String getJobId() {
    return jobId;
  }

  /** Ends the stream from the bus side, e.g. when the job is evicted. */
  void terminate() {
    closed = true;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      onClose.accept(this);
    }
  }
}
