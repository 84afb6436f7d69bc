package com.scholary.djset.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.djset.config.ProgressProperties;
import com.scholary.djset.progress.ProgressBus;
import com.scholary.djset.progress.ProgressEvent;
import com.scholary.djset.progress.ProgressStage;
import com.scholary.djset.progress.ProgressSubscription;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class ProgressStreamerTest {

  @Test
  void stream_shouldEndAndUnsubscribeAfterTerminalEvent() {
    ProgressProperties properties = new ProgressProperties(8, Duration.ofMinutes(1));
    ProgressBus bus = new ProgressBus(properties);
    ProgressStreamer streamer =
        new ProgressStreamer(new ConcurrentTaskExecutor(Runnable::run), properties);
    ProgressSubscription subscription = bus.subscribe("job-1");
    bus.append("job-1", ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "Downloading"));
    bus.append("job-1", ProgressEvent.of(ProgressStage.COMPLETE, 1.0, "Done"));

    SseEmitter emitter = streamer.stream(subscription);

    assertThat(emitter.getTimeout()).isEqualTo(Duration.ofMinutes(1).toMillis());
    assertThat(subscription.isFinished()).isTrue();
    assertThat(bus.subscriberCount("job-1")).isZero();
  }

  @Test
  void stream_shouldDisconnectOverflowedSubscriber() {
    ProgressProperties properties = new ProgressProperties(1, Duration.ofMinutes(1));
    ProgressBus bus = new ProgressBus(properties);
    ProgressStreamer streamer =
        new ProgressStreamer(new ConcurrentTaskExecutor(Runnable::run), properties);
    ProgressSubscription subscription = bus.subscribe("job-1");
    bus.append("job-1", ProgressEvent.of(ProgressStage.DOWNLOADING, 0.1, "one"));
    bus.append("job-1", ProgressEvent.of(ProgressStage.DOWNLOADING, 0.2, "two"));

    streamer.stream(subscription);

    assertThat(subscription.isFinished()).isTrue();
    assertThat(bus.subscriberCount("job-1")).isZero();
    assertThat(bus.history("job-1")).hasSize(2);
  }
}
