package com.scholary.djset.worker;

import com.scholary.djset.progress.ProgressEvent;

/** Receives the events a worker emits for its job. Safe to call from several threads. */
@FunctionalInterface
public interface ProgressSink {

  void emit(ProgressEvent event);
}
