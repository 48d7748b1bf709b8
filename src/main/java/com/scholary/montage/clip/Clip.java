package com.scholary.montage.clip;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A scored video segment belonging to one user and one week bucket.
 *
 * <p>The segment is the half-open interval [startSec, endSec) of the media at {@code mediaUrl}.
 * Clips are created once scoring succeeds and are never modified afterwards, only deleted.
 *
 * @param id clip identifier
 * @param userId owning user
 * @param mediaUrl URL of the original uploaded media (also identifies the source video)
 * @param thumbnailUrl URL of the clip thumbnail, may be null
 * @param startSec segment start in seconds
 * @param endSec segment end in seconds, strictly greater than startSec
 * @param description short description produced by the scorer
 * @param scores relevance, quality and confidence
 * @param score composite score stored at creation time
 * @param capturedAt when the clip was captured/uploaded; montages are ordered by it
 * @param weekEnding the week bucket the clip belongs to
 */
public record Clip(
    String id,
    String userId,
    String mediaUrl,
    String thumbnailUrl,
    double startSec,
    double endSec,
    String description,
    ClipScores scores,
    double score,
    Instant capturedAt,
    LocalDate weekEnding) {

  public Clip {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(scores, "scores");
    Objects.requireNonNull(capturedAt, "capturedAt");
    Objects.requireNonNull(weekEnding, "weekEnding");
    if (startSec < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endSec <= startSec) {
      throw new IllegalArgumentException(
          String.format("End time must be > start time: [%s, %s)", startSec, endSec));
    }
  }

  public double durationSec() {
    return endSec - startSec;
  }
}
