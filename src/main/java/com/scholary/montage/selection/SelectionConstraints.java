package com.scholary.montage.selection;

/**
 * Duration band the selected clips should fall into.
 *
 * @param minDurationSec lower bound, only reachable by modes that add clips
 * @param maxDurationSec upper bound
 */
public record SelectionConstraints(double minDurationSec, double maxDurationSec) {

  public SelectionConstraints {
    if (minDurationSec < 0) {
      throw new IllegalArgumentException("Minimum duration cannot be negative");
    }
    if (maxDurationSec <= 0) {
      throw new IllegalArgumentException("Maximum duration must be positive");
    }
    if (minDurationSec > maxDurationSec) {
      throw new IllegalArgumentException(
          String.format(
              "Minimum duration %s exceeds maximum duration %s", minDurationSec, maxDurationSec));
    }
  }
}
