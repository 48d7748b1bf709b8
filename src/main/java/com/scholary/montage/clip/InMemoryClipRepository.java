package com.scholary.montage.clip;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Caffeine-backed clip store.
 *
 * <p>Entries expire after the retention window, which is longer than a week bucket so a pool is
 * complete when its montage runs.
 */
@Repository
public class InMemoryClipRepository implements ClipRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryClipRepository.class);

  private final Cache<String, Clip> cache;

  public InMemoryClipRepository(
      @Value("${store.maxSize}") int maxSize,
      @Value("${store.clipRetentionDays}") int retentionDays) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofDays(retentionDays))
            .build();

    LOGGER.info("Initialized clip store: maxSize={}, retentionDays={}", maxSize, retentionDays);
  }

  @Override
  public void save(Clip clip) {
    cache.put(clip.id(), clip);
  }

  @Override
  public Optional<Clip> findById(String clipId) {
    return Optional.ofNullable(cache.getIfPresent(clipId));
  }

  @Override
  public List<Clip> findByUserAndWeek(String userId, LocalDate weekEnding) {
    return cache.asMap().values().stream()
        .filter(clip -> clip.userId().equals(userId) && clip.weekEnding().equals(weekEnding))
        .sorted(Comparator.comparingDouble(Clip::score).reversed().thenComparing(Clip::id))
        .toList();
  }

  @Override
  public void delete(String clipId) {
    cache.invalidate(clipId);
  }
}
