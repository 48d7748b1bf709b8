package com.scholary.montage.logging;

import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Event methods put their fields into the MDC for the duration of one log call. The job context
 * stays in place for a whole pipeline run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: {} in {}ms", stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure. Non-fatal failures are logged at warn level. */
  public void logStageFailed(String stage, boolean fatal, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("fatal", String.valueOf(fatal));
      MDC.put("errorType", errorType);

      if (fatal) {
        logger.error("Stage failed: {}, error={}, message={}", stage, errorType, message);
      } else {
        logger.warn(
            "Non-fatal stage failed, continuing: {}, error={}, message={}",
            stage,
            errorType,
            message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a selected clip that could not be normalized and is left out of the montage. */
  public void logClipSkipped(int position, String clipId, String reason) {
    try {
      MDC.put("event_type", "clip_skipped");
      MDC.put("position", String.valueOf(position));
      MDC.put("clipId", clipId);

      logger.warn("Clip skipped: position={}, clip={}, reason={}", position, clipId, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log selection summary. */
  public void logSelection(
      String mode, int candidates, int selected, double initialSeconds, double finalSeconds) {
    try {
      MDC.put("event_type", "selection");
      MDC.put("mode", mode);
      MDC.put("candidates", String.valueOf(candidates));
      MDC.put("selected", String.valueOf(selected));
      MDC.put("durationSeconds", String.valueOf(finalSeconds));

      logger.info(
          "Selection: mode={}, clips={}/{}, duration={}s -> {}s",
          mode,
          selected,
          candidates,
          initialSeconds,
          finalSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log job outcome event. */
  public void logJobFinished(String jobId, String status, long elapsedMs, String reason) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      if (reason == null) {
        logger.info("Job finished: jobId={}, status={}, elapsed={}ms", jobId, status, elapsedMs);
      } else {
        logger.warn(
            "Job finished: jobId={}, status={}, elapsed={}ms, reason={}",
            jobId,
            status,
            elapsedMs,
            reason);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String userId, LocalDate weekEnding) {
    MDC.put("jobId", jobId);
    MDC.put("userId", userId);
    if (weekEnding != null) {
      MDC.put("weekEnding", weekEnding.toString());
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("userId");
    MDC.remove("weekEnding");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
    MDC.remove("fatal");
    MDC.remove("errorType");
    MDC.remove("position");
    MDC.remove("clipId");
    MDC.remove("mode");
    MDC.remove("candidates");
    MDC.remove("selected");
    MDC.remove("durationSeconds");
    MDC.remove("status");
  }
}
