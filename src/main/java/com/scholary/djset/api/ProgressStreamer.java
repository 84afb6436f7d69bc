package com.scholary.djset.api;

import com.scholary.djset.config.ProgressProperties;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressSubscription;
import com.scholary.djset.progress.SubscriberOverflowException;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Pumps a job's progress subscription into a server-sent event stream.
 *
 * <p>Each event is sent with the stage as the SSE event name and the event as JSON data. The
 * stream completes after the terminal event. A client that falls behind is disconnected with a
 * final {@code overflow} event; a client that goes away just closes its subscription.
 */
@Component
public class ProgressStreamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressStreamer.class);

  static final String OVERFLOW_EVENT = "overflow";
  private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

  private final AsyncTaskExecutor streamExecutor;
  private final Duration streamTimeout;

  public ProgressStreamer(
      @Qualifier("streamExecutor") AsyncTaskExecutor streamExecutor,
      ProgressProperties properties) {
    this.streamExecutor = streamExecutor;
    this.streamTimeout = properties.streamTimeout();
  }

  public SseEmitter stream(ProgressSubscription subscription) {
    SseEmitter emitter = new SseEmitter(streamTimeout.toMillis());
    emitter.onCompletion(subscription::close);
    emitter.onTimeout(subscription::close);
    emitter.onError(error -> subscription.close());

    try {
      streamExecutor.execute(() -> pump(subscription, emitter));
    } catch (TaskRejectedException e) {
      LOGGER.warn("No stream capacity left: jobId={}", subscription.getJobId());
      subscription.close();
      emitter.completeWithError(e);
    }
    return emitter;
  }

  private void pump(ProgressSubscription subscription, SseEmitter emitter) {
    String jobId = subscription.getJobId();
    try {
      while (!subscription.isFinished()) {
        Optional<ProgressEvent> next = subscription.poll(POLL_INTERVAL);
        if (next.isPresent()) {
          ProgressEvent event = next.get();
          emitter.send(SseEmitter.event().name(event.stage().wireName()).data(event));
        }
      }
      emitter.complete();
    } catch (SubscriberOverflowException e) {
      LOGGER.warn("Disconnecting slow stream client: jobId={}", jobId);
      sendOverflow(emitter, e);
    } catch (IOException e) {
      LOGGER.debug("Stream client went away: jobId={}, cause={}", jobId, e.getMessage());
      emitter.completeWithError(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      emitter.complete();
    } finally {
      subscription.close();
    }
  }

  private void sendOverflow(SseEmitter emitter, SubscriberOverflowException overflow) {
    try {
      emitter.send(
          SseEmitter.event().name(OVERFLOW_EVENT).data(ErrorResponse.of(overflow.getMessage())));
      emitter.complete();
    } catch (IOException e) {
      emitter.completeWithError(e);
    }
  }
}
