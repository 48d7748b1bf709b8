package com.scholary.montage.profile;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/** Weekly upload counters kept in a size-bounded Caffeine cache. */
@Repository
public class InMemoryUploadCounterRepository implements UploadCounterRepository {

  private final Cache<String, Integer> counters;

  public InMemoryUploadCounterRepository(@Value("${store.maxSize}") int maxSize) {
    this.counters = Caffeine.newBuilder().maximumSize(maxSize).build();
  }

  @Override
  public int increment(String userId) {
    return counters.asMap().merge(userId, 1, Integer::sum);
  }

  @Override
  public void reset(String userId) {
    counters.put(userId, 0);
  }

  @Override
  public int get(String userId) {
    Integer count = counters.getIfPresent(userId);
    return count == null ? 0 : count;
  }
}
