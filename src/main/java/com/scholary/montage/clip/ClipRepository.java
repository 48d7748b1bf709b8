package com.scholary.montage.clip;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for scored clips.
 *
 * <p>The montage pipeline only reads clips by user and week bucket; the upload pipeline writes
 * them and the API deletes them.
 */
public interface ClipRepository {

  void save(Clip clip);

  Optional<Clip> findById(String clipId);

  /**
   * Fetch the candidate pool for one user and week bucket.
   *
   * @return clips ordered by stored score, highest first
   */
  List<Clip> findByUserAndWeek(String userId, LocalDate weekEnding);

  void delete(String clipId);
}
