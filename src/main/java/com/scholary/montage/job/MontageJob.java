package com.scholary.montage.job;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persisted record of one montage assembly run.
 *
 * <p>Created in {@link MontageJobStatus#PROCESSING} before any expensive work starts, so a run
 * that dies midway still leaves an inspectable record. Instances are immutable; {@link
 * #apply(MontageJobUpdate)} yields the next state.
 */
public record MontageJob(
    String id,
    String userId,
    LocalDate weekEnding,
    MontageJobStatus status,
    String videoUrl,
    String thumbnailUrl,
    String failureReason,
    Instant createdAt,
    Instant completedAt) {

  public static MontageJob processing(
      String id, String userId, LocalDate weekEnding, Instant createdAt) {
    return new MontageJob(
        id, userId, weekEnding, MontageJobStatus.PROCESSING, null, null, null, createdAt, null);
  }

  /**
   * Apply a status change.
   *
   * @throws IllegalStateException if the job is already terminal
   */
  public MontageJob apply(MontageJobUpdate update) {
    if (!status.canTransitionTo(update.status())) {
      throw new IllegalStateException(
          String.format("Montage job %s cannot move from %s to %s", id, status, update.status()));
    }
    return new MontageJob(
        id,
        userId,
        weekEnding,
        update.status(),
        update.videoUrl(),
        update.thumbnailUrl(),
        update.failureReason(),
        createdAt,
        update.completedAt());
  }
}
