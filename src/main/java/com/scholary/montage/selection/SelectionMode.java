package com.scholary.montage.selection;

/** Selection algorithm for a montage run. */
public enum SelectionMode {
  /**
   * Keep the whole pool and prune it down to the maximum duration.
   *
   * <p>Redundant clips go first, then the lowest scoring ones.
   */
  FLAT_POOL,

  /**
   * Build the montage from the best segment of each source video.
   *
   * <p>Starts with a strict score threshold and relaxes it until the minimum duration is reached.
   */
  PER_SOURCE
}
