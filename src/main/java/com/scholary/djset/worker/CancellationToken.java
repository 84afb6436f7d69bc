package com.scholary.djset.worker;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal shared between the lifecycle manager and a worker.
 *
 * <p>Workers poll {@link #throwIfCancelled()} at safe points and may register callbacks to abort
 * blocking work, such as destroying an external process. A callback registered after
 * cancellation runs immediately.
 */
public class CancellationToken {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /**
   * Signal cancellation.
   *
   * @return true if this call cancelled the token, false if it was already cancelled
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Runnable callback : callbacks) {
      runCallback(callback);
    }
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * @throws JobCancelledException if cancellation was requested
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new JobCancelledException();
    }
  }

  /** Register a callback to run on cancellation. */
  public void onCancel(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      runCallback(callback);
    }
  }

  public void removeCallback(Runnable callback) {
    callbacks.remove(callback);
  }

  private void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOGGER.warn("Cancellation callback failed", e);
    }
  }
}
