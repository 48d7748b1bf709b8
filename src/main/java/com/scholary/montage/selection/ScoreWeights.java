package com.scholary.montage.selection;

import com.scholary.montage.clip.ClipScores;

/** Weights blending relevance, quality and confidence into one composite score. */
public record ScoreWeights(double relevance, double quality, double confidence) {

  public static final ScoreWeights DEFAULT = new ScoreWeights(0.7, 0.2, 0.1);

  public ScoreWeights {
    if (relevance < 0 || quality < 0 || confidence < 0) {
      throw new IllegalArgumentException("Score weights cannot be negative");
    }
  }

  public double composite(ClipScores scores) {
    return relevance * scores.relevance()
        + quality * scores.quality()
        + confidence * scores.confidence();
  }
}
