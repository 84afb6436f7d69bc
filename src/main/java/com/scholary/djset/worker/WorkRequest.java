package com.scholary.djset.worker;

import com.scholary.djset.tracklist.Tracklist;

/**
 * Everything a worker needs for one job, with service defaults already applied.
 *
 * @param maxConcurrentTasks how many tracks may be cut in parallel
 */
public record WorkRequest(
    String jobId,
    String sourceUrl,
    Tracklist tracklist,
    String fileExtension,
    int maxConcurrentTasks) {}
