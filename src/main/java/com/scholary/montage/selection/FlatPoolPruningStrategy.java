package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes a flat candidate pool down to the maximum duration.
 *
 * <p>When the pool already fits, every candidate is kept. Otherwise clips are removed in two
 * phases, stopping as soon as the pool fits:
 *
 * <ol>
 *   <li>Redundancy pruning: remove clips named by the redundancy hints, in hint order. Clips not
 *       named by a hint are never touched in this phase.
 *   <li>Score-floor pruning: remove the remaining clip with the lowest effective score, one at a
 *       time. Ties go to the smaller clip id.
 * </ol>
 *
 * <p>Removals are tracked as flags over the scored candidate list, so hint indices keep pointing
 * at the same candidates however many clips have been removed. The last remaining clip is never
 * removed: a pool of one over-long clip yields that clip rather than nothing.
 */
public class FlatPoolPruningStrategy implements SelectionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(FlatPoolPruningStrategy.class);

  private final CandidateScorer scorer;

  public FlatPoolPruningStrategy(CandidateScorer scorer) {
    this.scorer = scorer;
  }

  @Override
  public Selection select(SelectionContext context) {
    List<ScoredCandidate> arena = scorer.score(context.candidates());
    if (arena.isEmpty()) {
      return Selection.empty(mode());
    }

    double maxDuration = context.constraints().maxDurationSec();
    double initialDuration = arena.stream().mapToDouble(ScoredCandidate::durationSec).sum();

    Pool pool = new Pool(arena, initialDuration);
    List<String> redundantRemoved = new ArrayList<>();
    List<String> lowScoreRemoved = new ArrayList<>();

    if (fits(pool.duration, maxDuration)) {
      LOGGER.debug(
          "Pool fits without pruning: {} clips, {}s <= {}s",
          arena.size(),
          format(initialDuration),
          format(maxDuration));
    } else {
      LOGGER.info(
          "Pruning pool: {} clips, {}s > {}s", arena.size(), format(initialDuration), format(maxDuration));
      pruneRedundant(pool, context.redundantIndices(), maxDuration, redundantRemoved);
      if (!fits(pool.duration, maxDuration)) {
        pruneLowestScores(pool, maxDuration, lowScoreRemoved);
      }
    }

    List<Clip> selected = new ArrayList<>();
    for (ScoredCandidate candidate : arena) {
      if (!pool.removed[candidate.index()]) {
        selected.add(candidate.clip());
      }
    }
    selected.sort(CHRONOLOGICAL);

    LOGGER.info(
        "Flat pool selection: {} of {} clips, {}s (redundant removed={}, low score removed={})",
        selected.size(),
        arena.size(),
        format(pool.duration),
        redundantRemoved.size(),
        lowScoreRemoved.size());

    return new Selection(
        selected,
        pool.duration,
        new Selection.Diagnostics(
            mode(), arena.size(), initialDuration, redundantRemoved, lowScoreRemoved, null));
  }

  private void pruneRedundant(
      Pool pool, List<Integer> hints, double maxDuration, List<String> removedIds) {
    for (Integer index : hints) {
      if (fits(pool.duration, maxDuration) || pool.remaining == 1) {
        return;
      }
      if (index == null || index < 0 || index >= pool.arena.size() || pool.removed[index]) {
        continue;
      }
      ScoredCandidate candidate = pool.arena.get(index);
      pool.remove(candidate);
      removedIds.add(candidate.clip().id());
      LOGGER.debug(
          "Redundancy prune: removed index={} clip={}, duration now {}s",
          index,
          candidate.clip().id(),
          format(pool.duration));
    }
  }

  private void pruneLowestScores(Pool pool, double maxDuration, List<String> removedIds) {
    List<ScoredCandidate> ascending = new ArrayList<>();
    for (ScoredCandidate candidate : pool.arena) {
      if (!pool.removed[candidate.index()]) {
        ascending.add(candidate);
      }
    }
    ascending.sort(
        Comparator.comparingDouble(ScoredCandidate::effectiveScore)
            .thenComparing(candidate -> candidate.clip().id()));

    for (ScoredCandidate candidate : ascending) {
      if (fits(pool.duration, maxDuration) || pool.remaining == 1) {
        return;
      }
      pool.remove(candidate);
      removedIds.add(candidate.clip().id());
      LOGGER.debug(
          "Score prune: removed clip={} score={}, duration now {}s",
          candidate.clip().id(),
          format(candidate.effectiveScore()),
          format(pool.duration));
    }
  }

  private static boolean fits(double duration, double maxDuration) {
    return duration <= maxDuration + EPSILON;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  @Override
  public SelectionMode mode() {
    return SelectionMode.FLAT_POOL;
  }

  @Override
  public String getStrategyName() {
    return "FlatPoolPruning";
  }

  /** Mutable bookkeeping for one run. */
  private static final class Pool {
    private final List<ScoredCandidate> arena;
    private final boolean[] removed;
    private int remaining;
    private double duration;

    private Pool(List<ScoredCandidate> arena, double duration) {
      this.arena = arena;
      this.removed = new boolean[arena.size()];
      this.remaining = arena.size();
      this.duration = duration;
    }

    private void remove(ScoredCandidate candidate) {
      removed[candidate.index()] = true;
      remaining--;
      duration -= candidate.durationSec();
    }
  }
}
