package com.scholary.montage.service;

/** A fatal stage failure. The reason is recorded on the failed job. */
public class MontagePipelineException extends RuntimeException {

  private final PipelineStage stage;
  private final String reason;

  public MontagePipelineException(PipelineStage stage, String reason) {
    super(stage + ": " + reason);
    this.stage = stage;
    this.reason = reason;
  }

  public MontagePipelineException(PipelineStage stage, String reason, Throwable cause) {
    super(stage + ": " + reason, cause);
    this.stage = stage;
    this.reason = reason;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public String getReason() {
    return reason;
  }
}
