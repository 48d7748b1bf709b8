package com.scholary.montage.selection;

import com.scholary.montage.clip.Clip;
import com.scholary.montage.clip.ClipScores;
import java.time.Instant;
import java.time.LocalDate;

/** Clip fixtures for selection tests. */
final class TestClips {

  static final Instant BASE = Instant.parse("2026-10-12T08:00:00Z");
  static final LocalDate WEEK = LocalDate.of(2026, 10, 18);

  private TestClips() {}

  /** A clip starting at 0 with the given duration, relevance only, captured {@code minute} minutes after BASE. */
  static Clip clip(String id, double durationSec, double relevance, int minute) {
    return clip(id, durationSec, relevance, minute, "s3://bucket/clips/" + id + ".mp4");
  }

  static Clip clip(String id, double durationSec, double relevance, int minute, String mediaUrl) {
    ClipScores scores = new ClipScores(relevance, 0.0, 0.0);
    return new Clip(
        id,
        "user-1",
        mediaUrl,
        null,
        0.0,
        durationSec,
        "clip " + id,
        scores,
        ScoreWeights.DEFAULT.composite(scores),
        BASE.plusSeconds(60L * minute),
        WEEK);
  }
}
