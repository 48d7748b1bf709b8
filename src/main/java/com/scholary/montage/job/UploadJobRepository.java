package com.scholary.montage.job;

import java.util.Optional;

/** Persistence for upload analysis jobs. */
public interface UploadJobRepository {

  void save(UploadJob job);

  Optional<UploadJob> findById(String jobId);

  void delete(String jobId);
}
