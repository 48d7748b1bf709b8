package com.scholary.montage.clip;

/**
 * Scores attached to a clip by the content-analysis service.
 *
 * <p>Each score is in [0, 1].
 */
public record ClipScores(double relevance, double quality, double confidence) {

  public ClipScores {
    requireUnit("relevance", relevance);
    requireUnit("quality", quality);
    requireUnit("confidence", confidence);
  }

  /** Build scores from raw values, clamping each into [0, 1]. NaN becomes 0. */
  public static ClipScores clamped(double relevance, double quality, double confidence) {
    return new ClipScores(clamp(relevance), clamp(quality), clamp(confidence));
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " score must be within [0, 1]: " + value);
    }
  }

  private static double clamp(double value) {
    if (Double.isNaN(value) || value < 0.0) {
      return 0.0;
    }
    return Math.min(1.0, value);
  }
}
