package com.scholary.montage.profile;

/** Per-user count of clips uploaded in the current week. */
public interface UploadCounterRepository {

  /** @return the count after incrementing */
  int increment(String userId);

  void reset(String userId);

  int get(String userId);
}
