package com.scholary.djset.api;

/** Returned when a job is accepted. Poll or stream with the job ID. */
public record ProcessResponse(String message, String jobId) {}
