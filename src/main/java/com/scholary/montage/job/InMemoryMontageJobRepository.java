package com.scholary.montage.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for montage jobs.
 *
 * <p>Uses a Caffeine cache so old jobs are evicted once they are past the retention window. Status
 * changes go through {@code compute}, so concurrent updates to the same job are serialised and the
 * state machine is checked against the stored value.
 */
@Repository
public class InMemoryMontageJobRepository implements MontageJobRepository {

  private final Cache<String, MontageJob> cache;
  private final Clock clock;

  public InMemoryMontageJobRepository(
      Clock clock,
      @Value("${store.maxSize}") int maxSize,
      @Value("${store.jobRetentionDays}") int retentionDays) {

    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofDays(retentionDays))
            .build();
  }

  @Override
  public MontageJob create(String userId, LocalDate weekEnding) {
    MontageJob job =
        MontageJob.processing(UUID.randomUUID().toString(), userId, weekEnding, clock.instant());
    cache.put(job.id(), job);
    return job;
  }

  @Override
  public MontageJob update(String jobId, MontageJobUpdate update) {
    MontageJob updated =
        cache.asMap().computeIfPresent(jobId, (id, current) -> current.apply(update));
    if (updated == null) {
      throw new JobNotFoundException(jobId);
    }
    return updated;
  }

  @Override
  public Optional<MontageJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  @Override
  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
