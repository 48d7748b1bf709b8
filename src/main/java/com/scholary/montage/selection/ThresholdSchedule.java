package com.scholary.montage.selection;

/**
 * Descending score thresholds tried by the per-source mode.
 *
 * @param start first (strictest) threshold
 * @param step amount the threshold drops per retry
 * @param floor last threshold tried
 */
public record ThresholdSchedule(double start, double step, double floor) {

  public ThresholdSchedule {
    if (step <= 0) {
      throw new IllegalArgumentException("Threshold step must be positive");
    }
    if (floor > start) {
      throw new IllegalArgumentException("Threshold floor cannot exceed the start threshold");
    }
  }

  /** Number of thresholds in the schedule, start and floor included. */
  public int size() {
    return (int) Math.floor((start - floor) / step + 1e-9) + 1;
  }

  public double thresholdAt(int attempt) {
    return Math.max(floor, start - attempt * step);
  }
}
