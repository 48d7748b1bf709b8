package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.Comparator;

/**
 * Strategy for reducing a candidate pool to a duration-bounded selection.
 *
 * <p>Implementations are pure: no I/O, and the same input always yields the same selection.
 */
public interface SelectionStrategy {

  /** Tolerance for floating point duration sums. */
  double EPSILON = 1e-9;

  /** Timeline order used for every emitted selection. */
  Comparator<Clip> CHRONOLOGICAL =
      Comparator.comparing(Clip::capturedAt)
          .thenComparingDouble(Clip::startSec)
          .thenComparing(Clip::id);

  Selection select(SelectionContext context);

  SelectionMode mode();

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();
}
