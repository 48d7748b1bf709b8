package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.List;

/**
 * Outcome of a selection run: the chosen clips in chronological order.
 *
 * @param clips selected clips ordered by capture time
 * @param totalDurationSec sum of the selected clip durations
 * @param diagnostics how the selection was reached
 */
public record Selection(List<Clip> clips, double totalDurationSec, Diagnostics diagnostics) {

  public Selection {
    clips = List.copyOf(clips);
  }

  public static Selection empty(SelectionMode mode) {
    return new Selection(List.of(), 0.0, new Diagnostics(mode, 0, 0.0, List.of(), List.of(), null));
  }

  public boolean isEmpty() {
    return clips.isEmpty();
  }

  /**
   * Selection diagnostics.
   *
   * @param mode the mode that produced the selection
   * @param candidateCount size of the input pool
   * @param initialDurationSec total duration of the input pool
   * @param redundantRemovedIds clip ids removed by redundancy pruning, in removal order
   * @param lowScoreRemovedIds clip ids removed by score-floor pruning, in removal order
   * @param threshold score threshold the per-source mode settled on, null for the flat pool
   */
  public record Diagnostics(
      SelectionMode mode,
      int candidateCount,
      double initialDurationSec,
      List<String> redundantRemovedIds,
      List<String> lowScoreRemovedIds,
      Double threshold) {

    public Diagnostics {
      redundantRemovedIds = List.copyOf(redundantRemovedIds);
      lowScoreRemovedIds = List.copyOf(lowScoreRemovedIds);
    }
  }
}
