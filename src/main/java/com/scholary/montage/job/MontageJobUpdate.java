package com.scholary.montage.job;

import java.time.Instant;
import java.util.Objects;

/**
 * A status change for a montage job, with the fields that accompany it.
 *
 * @param status the new status, always terminal
 * @param videoUrl reference to the published montage, set on completion
 * @param thumbnailUrl reference to the published thumbnail, set on completion
 * @param completedAt completion timestamp, set on completion
 * @param failureReason human-readable reason, set on failure where available
 */
public record MontageJobUpdate(
    MontageJobStatus status,
    String videoUrl,
    String thumbnailUrl,
    Instant completedAt,
    String failureReason) {

  public MontageJobUpdate {
    Objects.requireNonNull(status, "status");
  }

  public static MontageJobUpdate complete(String videoUrl, String thumbnailUrl, Instant at) {
    return new MontageJobUpdate(MontageJobStatus.COMPLETE, videoUrl, thumbnailUrl, at, null);
  }

  public static MontageJobUpdate failed(String reason) {
    return new MontageJobUpdate(MontageJobStatus.FAILED, null, null, null, reason);
  }
}
