package com.scholary.montage.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a montage run.
 *
 * <p>A job starts in {@link #PROCESSING} and moves exactly once to {@link #COMPLETE} or {@link
 * #FAILED}.
 */
public enum MontageJobStatus {
  PROCESSING,
  COMPLETE,
  FAILED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  public boolean canTransitionTo(MontageJobStatus next) {
    return this == PROCESSING && next.isTerminal();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
