package com.scholary.djset.progress;

import com.scholary.djset.config.ProgressProperties;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-job append-only event log with live fan-out to subscribers.
 *
 * <p>Each job gets its own channel with its own monitor, so appends for different jobs never
 * contend. Within a channel, appending to the log and offering to subscribers happen in one
 * synchronized step: every subscriber sees the events of a job in log order.
 *
 * <p>Subscribers are buffered with a fixed capacity. A subscriber whose buffer is full is
 * disconnected (it will see {@link SubscriberOverflowException}); the producer never blocks.
 */
@Component
public class ProgressBus {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressBus.class);

  private final ConcurrentMap<String, JobChannel> channels = new ConcurrentHashMap<>();
  private final int subscriberBuffer;

  public ProgressBus(ProgressProperties properties) {
    this.subscriberBuffer = properties.subscriberBuffer();
    LOGGER.info("Initialized progress bus: subscriberBuffer={}", subscriberBuffer);
  }

  /**
   * Append an event to the job's log and publish it to the job's live subscribers.
   *
   * @throws IllegalStateException if the job's log already ends with a terminal event
   */
  public void append(String jobId, ProgressEvent event) {
    channel(jobId).append(event);
  }

  /** Subscribe to events appended from now on. */
  public ProgressSubscription subscribe(String jobId) {
    return channel(jobId).subscribe();
  }

  /** Full ordered history of the job, empty if nothing was appended yet. */
  public List<ProgressEvent> history(String jobId) {
    JobChannel channel = channels.get(jobId);
    return channel == null ? List.of() : channel.snapshot();
  }

  public int subscriberCount(String jobId) {
    JobChannel channel = channels.get(jobId);
    return channel == null ? 0 : channel.subscriberCount();
  }

  /** Drop the job's log and end its open subscriptions. */
  public void release(String jobId) {
    JobChannel channel = channels.remove(jobId);
    if (channel != null) {
      channel.closeAll();
      LOGGER.debug("Released progress channel: jobId={}", jobId);
    }
  }

  private JobChannel channel(String jobId) {
    return channels.computeIfAbsent(jobId, JobChannel::new);
  }

  private final class JobChannel {

    private final String jobId;
    private final List<ProgressEvent> log = new ArrayList<>();
    private final List<ProgressSubscription> subscribers = new ArrayList<>();
    private boolean finished;

    JobChannel(String jobId) {
      this.jobId = jobId;
    }

    synchronized void append(ProgressEvent event) {
      if (finished) {
        throw new IllegalStateException("Event log of job " + jobId + " is already terminated");
      }
      log.add(event);
      finished = event.isTerminal();

      Iterator<ProgressSubscription> it = subscribers.iterator();
      while (it.hasNext()) {
        ProgressSubscription subscription = it.next();
        if (!subscription.offer(event)) {
          it.remove();
          LOGGER.warn(
              "Disconnected slow progress subscriber: jobId={}, buffer={}",
              jobId,
              subscriberBuffer);
        }
      }

      // Subscribers end themselves after consuming the terminal event.
      if (finished) {
        subscribers.clear();
      }
    }

    synchronized ProgressSubscription subscribe() {
      ProgressSubscription subscription =
          new ProgressSubscription(jobId, subscriberBuffer, this::unsubscribe);
      if (finished) {
        subscription.offer(log.get(log.size() - 1));
      } else {
        subscribers.add(subscription);
      }
      return subscription;
    }

    synchronized void unsubscribe(ProgressSubscription subscription) {
      subscribers.remove(subscription);
    }

    synchronized List<ProgressEvent> snapshot() {
      return List.copyOf(log);
    }

    synchronized int subscriberCount() {
      return subscribers.size();
    }

    synchronized void closeAll() {
      subscribers.forEach(ProgressSubscription::terminate);
      subscribers.clear();
    }
  }
}
