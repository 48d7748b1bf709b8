package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns clips into {@link ScoredCandidate}s.
 *
 * <p>Clips longer than the long-clip threshold keep their place in the pool but rank lower through
 * the penalty multiplier.
 */
public class CandidateScorer {

  private final ScoreWeights weights;
  private final double longClipThresholdSec;
  private final double longClipPenalty;

  public CandidateScorer(ScoreWeights weights, double longClipThresholdSec, double longClipPenalty) {
    if (longClipPenalty <= 0 || longClipPenalty > 1) {
      throw new IllegalArgumentException("Long clip penalty must be in (0, 1]: " + longClipPenalty);
    }
    this.weights = weights;
    this.longClipThresholdSec = longClipThresholdSec;
    this.longClipPenalty = longClipPenalty;
  }

  public List<ScoredCandidate> score(List<Clip> clips) {
    List<ScoredCandidate> scored = new ArrayList<>(clips.size());
    for (int i = 0; i < clips.size(); i++) {
      Clip clip = clips.get(i);
      double penalty = clip.durationSec() > longClipThresholdSec ? longClipPenalty : 1.0;
      scored.add(new ScoredCandidate(i, clip, weights.composite(clip.scores()), penalty));
    }
    return scored;
  }
}
