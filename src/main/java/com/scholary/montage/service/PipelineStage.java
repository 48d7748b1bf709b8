package com.scholary.montage.service;

/**
 * Stages of a montage run, in execution order.
 *
 * <p>A failure in a fatal stage fails the job. A non-fatal stage logs its failure and the run
 * continues as if it had produced its default result.
 *
 * <p>An interrupted run stops at the next cancellable stage. Stages from {@link #FINALIZE} on run
 * after the montage is published and always complete, so a published montage is never reported as
 * failed.
 */
public enum PipelineStage {
  FETCH(true, true),
  REDUNDANCY_HINTS(false, true),
  SELECT(true, true),
  NORMALIZE(true, true),
  ASSEMBLE(true, true),
  PUBLISH(true, true),
  FINALIZE(true, false),
  RESET_UPLOAD_COUNTER(false, false);

  private final boolean fatal;
  private final boolean cancellable;

  PipelineStage(boolean fatal, boolean cancellable) {
    this.fatal = fatal;
    this.cancellable = cancellable;
  }

  public boolean isFatal() {
    return fatal;
  }

  public boolean isCancellable() {
    return cancellable;
  }
}
