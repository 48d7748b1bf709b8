package com.scholary.montage.clip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class InMemoryClipRepositoryTest {

  private static final LocalDate WEEK = LocalDate.of(2026, 10, 18);

  private final InMemoryClipRepository repository = new InMemoryClipRepository(100, 30);

  @Test
  void findByUserAndWeek_returnsOnlyMatchingClipsHighestScoreFirst() {
    repository.save(clip("low", "user-1", WEEK, 0.2));
    repository.save(clip("high", "user-1", WEEK, 0.9));
    repository.save(clip("other-user", "user-2", WEEK, 0.5));
    repository.save(clip("other-week", "user-1", WEEK.plusWeeks(1), 0.5));

    assertThat(repository.findByUserAndWeek("user-1", WEEK))
        .extracting(Clip::id)
        .containsExactly("high", "low");
  }

  @Test
  void delete_removesClip() {
    repository.save(clip("a", "user-1", WEEK, 0.5));

    repository.delete("a");

    assertThat(repository.findById("a")).isEmpty();
  }

  @Test
  void clipRejectsEmptySegment() {
    assertThatThrownBy(
            () ->
                new Clip(
                    "x", "u", "url", null, 5, 5, "d", new ClipScores(0, 0, 0), 0,
                    Instant.EPOCH, WEEK))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Clip clip(String id, String userId, LocalDate week, double score) {
    return new Clip(
        id,
        userId,
        "http://store/" + id,
        null,
        0,
        5,
        "clip",
        new ClipScores(score, score, score),
        score,
        Instant.parse("2026-10-13T10:00:00Z"),
        week);
  }
}
