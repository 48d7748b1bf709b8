package com.scholary.montage.job;

import java.time.LocalDate;
import java.util.Optional;

/** Persistence for montage jobs. Only the montage pipeline mutates them. */
public interface MontageJobRepository {

  /**
   * Create a job in {@code processing} state.
   *
   * @return the persisted job, carrying its new id
   */
  MontageJob create(String userId, LocalDate weekEnding);

  /**
   * Apply a status change to an existing job.
   *
   * @return the updated job
   * @throws JobNotFoundException if no job has that id
   * @throws IllegalStateException if the transition is not allowed
   */
  MontageJob update(String jobId, MontageJobUpdate update);

  Optional<MontageJob> findById(String jobId);

  void delete(String jobId);
}
