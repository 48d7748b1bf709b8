package com.scholary.montage.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class InMemoryMontageJobRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
  private static final LocalDate WEEK = LocalDate.of(2026, 10, 18);

  private final InMemoryMontageJobRepository repository =
      new InMemoryMontageJobRepository(Clock.fixed(NOW, ZoneOffset.UTC), 100, 30);

  @Test
  void create_persistsProcessingJob() {
    MontageJob job = repository.create("user-1", WEEK);

    assertThat(job.status()).isEqualTo(MontageJobStatus.PROCESSING);
    assertThat(job.createdAt()).isEqualTo(NOW);
    assertThat(repository.findById(job.id())).contains(job);
  }

  @Test
  void complete_setsOutputReferences() {
    MontageJob job = repository.create("user-1", WEEK);

    MontageJob done =
        repository.update(job.id(), MontageJobUpdate.complete("video-url", "thumb-url", NOW));

    assertThat(done.status()).isEqualTo(MontageJobStatus.COMPLETE);
    assertThat(done.videoUrl()).isEqualTo("video-url");
    assertThat(done.thumbnailUrl()).isEqualTo("thumb-url");
    assertThat(done.completedAt()).isEqualTo(NOW);
  }

  @Test
  void terminalJobCannotTransitionAgain() {
    MontageJob job = repository.create("user-1", WEEK);
    repository.update(job.id(), MontageJobUpdate.failed("no clips"));

    assertThatThrownBy(
            () -> repository.update(job.id(), MontageJobUpdate.complete("v", "t", NOW)))
        .isInstanceOf(IllegalStateException.class);
    assertThat(repository.findById(job.id()).orElseThrow().status())
        .isEqualTo(MontageJobStatus.FAILED);
  }

  @Test
  void updatingUnknownJobFails() {
    assertThatThrownBy(() -> repository.update("missing", MontageJobUpdate.failed("x")))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void statusSerializesLowercase() {
    assertThat(MontageJobStatus.COMPLETE.wireName()).isEqualTo("complete");
    assertThat(MontageJobStatus.PROCESSING.canTransitionTo(MontageJobStatus.PROCESSING)).isFalse();
  }
}
