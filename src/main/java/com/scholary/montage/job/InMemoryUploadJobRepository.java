package com.scholary.montage.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/** Caffeine-backed upload job store with the same eviction policy as montage jobs. */
@Repository
public class InMemoryUploadJobRepository implements UploadJobRepository {

  private final Cache<String, UploadJob> cache;

  public InMemoryUploadJobRepository(
      @Value("${store.maxSize}") int maxSize,
      @Value("${store.jobRetentionDays}") int retentionDays) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofDays(retentionDays))
            .build();
  }

  @Override
  public void save(UploadJob job) {
    cache.put(job.jobId(), job);
  }

  @Override
  public Optional<UploadJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  @Override
  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
