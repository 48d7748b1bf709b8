package com.scholary.montage.job;

import java.time.Instant;

/**
 * Tracks analysis of one uploaded clip.
 *
 * <p>Created as soon as the upload is accepted so a client can poll before scoring finishes.
 */
public record UploadJob(
    String jobId,
    String userId,
    String uploadUrl,
    String filename,
    UploadJobStatus status,
    String clipId,
    String error,
    Instant updatedAt) {

  public static UploadJob processing(
      String jobId, String userId, String uploadUrl, String filename, Instant at) {
    return new UploadJob(
        jobId, userId, uploadUrl, filename, UploadJobStatus.PROCESSING, null, null, at);
  }

  public UploadJob completed(String clipId, Instant at) {
    return new UploadJob(
        jobId, userId, uploadUrl, filename, UploadJobStatus.COMPLETED, clipId, null, at);
  }

  public UploadJob failed(String error, Instant at) {
    return new UploadJob(
        jobId, userId, uploadUrl, filename, UploadJobStatus.FAILED, null, error, at);
  }
}
