package com.scholary.montage.job;

/** Thrown when a job id does not resolve to a stored job. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
