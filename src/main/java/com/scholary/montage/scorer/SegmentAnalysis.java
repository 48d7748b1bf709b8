package com.scholary.montage.scorer;

import com.scholary.montage.clip.ClipScores;

/**
 * Result of analysing one video.
 *
 * @param startSec segment start, never negative
 * @param endSec segment end, always after the start
 * @param description short description of the segment
 * @param scores relevance, quality and confidence
 * @param fallback true when the scorer failed and this is the default segment
 */
public record SegmentAnalysis(
    double startSec, double endSec, String description, ClipScores scores, boolean fallback) {

  public static final String FALLBACK_DESCRIPTION = "Video analysis failed.";

  /** Duration assumed when the video length is unknown. */
  static final double UNKNOWN_DURATION_SEC = 0.5;

  public SegmentAnalysis {
    if (startSec < 0) {
      throw new IllegalArgumentException("startSec cannot be negative: " + startSec);
    }
    if (endSec <= startSec) {
      throw new IllegalArgumentException(
          String.format("endSec %s must be after startSec %s", endSec, startSec));
    }
  }

  /** The default segment: the first seconds of the video, capped at {@code maxSeconds}. */
  public static SegmentAnalysis fallback(Double durationSec, double maxSeconds) {
    double duration =
        durationSec != null && durationSec > 0 ? durationSec : UNKNOWN_DURATION_SEC;
    return new SegmentAnalysis(
        0.0,
        Math.min(duration, maxSeconds),
        FALLBACK_DESCRIPTION,
        new ClipScores(0.5, 0.5, 0.5),
        true);
  }
}
