package com.scholary.montage.scorer;

import java.nio.file.Path;
import java.util.List;

/**
 * AI scoring of clips.
 *
 * <p>Both operations degrade instead of failing: callers always get a usable answer, either the
 * scorer's or a safe default.
 */
public interface ScorerService {

  /**
   * Rank clips that duplicate others, most redundant first.
   *
   * @param candidates clip descriptions keyed by their index in the caller's pool
   * @return indices to drop in priority order, or an empty list if the scorer cannot answer
   */
  List<Integer> suggestRedundant(List<RedundancyCandidate> candidates);

  /**
   * Find the single best segment of a video for the given intent.
   *
   * @param media local video file
   * @param intent natural-language description of what the user wants
   * @param durationSec probed duration of the video, or null if unknown
   * @return the scored segment, or the fallback segment if analysis fails
   */
  SegmentAnalysis analyzeSingleClip(Path media, String intent, Double durationSec);
}
