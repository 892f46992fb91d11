package com.scholary.aijobs.job;

/** No job exists with the requested id. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super(String.format("Job '%s' not found.", jobId));
  }
}
