package com.scholary.djset.worker;

/**
 * Downloads a DJ set and cuts it into tracks.
 *
 * <p>This abstraction lets the job lifecycle stay independent of how audio is fetched and cut.
 *
 * <p>Contract:
 *
 * <ul>
 *   <li>Emits a forward-moving sequence of events through the sink: downloading events, one
 *       importing event, processing events (one per finished track, carrying the artifact), and
 *       exactly one terminal event ({@code complete}, or {@code error} with a message).
 *   <li>Checks the token at safe points. Once cancelled it stops and throws {@link
 *       JobCancelledException}.
 *   <li>Any other failure may be thrown as {@link WorkerException} instead of emitting an error
 *       event; the caller records it as the job's terminal error.
 * </ul>
 */
public interface SplitWorker {

  void process(WorkRequest request, ProgressSink sink, CancellationToken token);
}
