package com.scholary.montage.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryUploadJobRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");

  private final InMemoryUploadJobRepository repository = new InMemoryUploadJobRepository(100, 30);

  @Test
  void saveReplacesPreviousState() {
    UploadJob job = UploadJob.processing("j1", "u1", "url", "a.mp4", NOW);
    repository.save(job);
    repository.save(job.completed("c1", NOW.plusSeconds(30)));

    UploadJob stored = repository.findById("j1").orElseThrow();
    assertThat(stored.status()).isEqualTo(UploadJobStatus.COMPLETED);
    assertThat(stored.clipId()).isEqualTo("c1");
    assertThat(stored.error()).isNull();
    assertThat(stored.updatedAt()).isEqualTo(NOW.plusSeconds(30));
  }

  @Test
  void deleteRemovesJob() {
    repository.save(UploadJob.processing("j1", "u1", "url", "a.mp4", NOW));

    repository.delete("j1");

    assertThat(repository.findById("j1")).isEmpty();
  }
}
