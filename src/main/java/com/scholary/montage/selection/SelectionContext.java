package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a selection strategy needs for one run.
 *
 * @param candidates the candidate pool; indices in {@code redundantIndices} refer to this list
 * @param constraints duration band
 * @param redundantIndices indices of redundant candidates, most redundant first; may be empty and
 *     may contain entries that do not point at any candidate
 */
public record SelectionContext(
    List<Clip> candidates, SelectionConstraints constraints, List<Integer> redundantIndices) {

  public SelectionContext {
    candidates = List.copyOf(candidates);
    redundantIndices =
        redundantIndices == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(redundantIndices));
  }

  public static SelectionContext withoutHints(
      List<Clip> candidates, SelectionConstraints constraints) {
    return new SelectionContext(candidates, constraints, List.of());
  }
}
