package com.scholary.aijobs.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Returned as soon as a try-on job is accepted. */
public record TryOnJobResponse(@JsonProperty("job_id") String jobId, String message) {}
