package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for montage selection.
 *
 * <p>Dispatches to the strategy registered for the requested mode. {@link SelectionMode#FLAT_POOL}
 * is the default.
 */
public class SelectionEngine {

  private final Map<SelectionMode, SelectionStrategy> strategies = new EnumMap<>(SelectionMode.class);

  public SelectionEngine(List<SelectionStrategy> strategies) {
    for (SelectionStrategy strategy : strategies) {
      this.strategies.put(strategy.mode(), strategy);
    }
    if (!this.strategies.containsKey(SelectionMode.FLAT_POOL)) {
      throw new IllegalArgumentException("A flat pool strategy is required");
    }
  }

  /** Flat-pool selection without redundancy hints. */
  public Selection selectMontage(List<Clip> candidates, SelectionConstraints constraints) {
    return select(SelectionMode.FLAT_POOL, SelectionContext.withoutHints(candidates, constraints));
  }

  public Selection select(SelectionMode mode, SelectionContext context) {
    SelectionStrategy strategy = strategies.get(mode);
    if (strategy == null) {
      throw new IllegalArgumentException("No selection strategy for mode " + mode);
    }
    return strategy.select(context);
  }
}
