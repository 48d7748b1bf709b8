package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks at most one segment per source video.
 *
 * <p>Candidates are taken best first as long as they meet the current score threshold, come from a
 * source not used yet and keep the total under the maximum duration. If the result stays below the
 * minimum duration the threshold is lowered and the selection is rebuilt from scratch, down to the
 * floor of the schedule. Redundancy hints are not used in this mode.
 */
public class PerSourceThresholdStrategy implements SelectionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(PerSourceThresholdStrategy.class);

  private final CandidateScorer scorer;
  private final ThresholdSchedule schedule;

  public PerSourceThresholdStrategy(CandidateScorer scorer, ThresholdSchedule schedule) {
    this.scorer = scorer;
    this.schedule = schedule;
  }

  @Override
  public Selection select(SelectionContext context) {
    List<ScoredCandidate> ranked = new ArrayList<>(scorer.score(context.candidates()));
    if (ranked.isEmpty()) {
      return Selection.empty(mode());
    }
    ranked.sort(
        Comparator.comparingDouble(ScoredCandidate::effectiveScore)
            .reversed()
            .thenComparing(candidate -> candidate.clip().id()));

    double initialDuration = ranked.stream().mapToDouble(ScoredCandidate::durationSec).sum();
    SelectionConstraints constraints = context.constraints();

    List<Clip> chosen = List.of();
    double total = 0.0;
    double threshold = schedule.start();
    for (int attempt = 0; attempt < schedule.size(); attempt++) {
      threshold = schedule.thresholdAt(attempt);
      chosen = pick(ranked, threshold, constraints.maxDurationSec());
      total = chosen.stream().mapToDouble(Clip::durationSec).sum();
      LOGGER.debug(
          "Per-source attempt {}: threshold={}, clips={}, duration={}s",
          attempt + 1,
          format(threshold),
          chosen.size(),
          format(total));
      if (total + EPSILON >= constraints.minDurationSec() && !chosen.isEmpty()) {
        break;
      }
    }

    if (chosen.isEmpty()) {
      Clip best = ranked.get(0).clip();
      LOGGER.info(
          "No clip met the threshold floor within {}s, keeping best clip {}",
          format(constraints.maxDurationSec()),
          best.id());
      chosen = List.of(best);
      total = best.durationSec();
    }

    List<Clip> ordered = new ArrayList<>(chosen);
    ordered.sort(CHRONOLOGICAL);

    LOGGER.info(
        "Per-source selection: {} of {} clips, {}s at threshold {}",
        ordered.size(),
        ranked.size(),
        format(total),
        format(threshold));

    return new Selection(
        ordered,
        total,
        new Selection.Diagnostics(
            mode(), ranked.size(), initialDuration, List.of(), List.of(), threshold));
  }

  private static List<Clip> pick(
      List<ScoredCandidate> ranked, double threshold, double maxDuration) {
    List<Clip> chosen = new ArrayList<>();
    Set<String> usedSources = new HashSet<>();
    double total = 0.0;
    for (ScoredCandidate candidate : ranked) {
      if (candidate.effectiveScore() < threshold) {
        // ranked best first, nothing further can qualify
        break;
      }
      String source = sourceOf(candidate.clip());
      if (usedSources.contains(source)) {
        continue;
      }
      if (total + candidate.durationSec() > maxDuration + EPSILON) {
        continue;
      }
      chosen.add(candidate.clip());
      usedSources.add(source);
      total += candidate.durationSec();
    }
    return chosen;
  }

  private static String sourceOf(Clip clip) {
    return clip.mediaUrl() != null ? clip.mediaUrl() : clip.id();
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  @Override
  public SelectionMode mode() {
    return SelectionMode.PER_SOURCE;
  }

  @Override
  public String getStrategyName() {
    return "PerSourceThreshold";
  }
}
