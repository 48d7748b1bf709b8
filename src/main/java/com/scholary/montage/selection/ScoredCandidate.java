package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;

/**
 * A clip under consideration during one selection run.
 *
 * @param index position of the clip in the candidate list handed to the engine
 * @param clip the clip
 * @param compositeScore weighted blend of the clip's scores
 * @param durationPenalty multiplier below 1 for over-long clips, otherwise 1
 */
public record ScoredCandidate(
    int index, Clip clip, double compositeScore, double durationPenalty) {

  /** Score used for ranking: the composite score with the duration penalty applied. */
  public double effectiveScore() {
    return compositeScore * durationPenalty;
  }

  public double durationSec() {
    return clip.durationSec();
  }
}
