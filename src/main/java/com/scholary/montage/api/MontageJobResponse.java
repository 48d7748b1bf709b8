package com.scholary.montage.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.montage.job.MontageJob;
import com.scholary.montage.job.MontageJobStatus;
import java.time.Instant;
import java.time.LocalDate;

/** Response for a montage job status query. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MontageJobResponse(
    String jobId,
    MontageJobStatus status,
    LocalDate weekEnding,
    String videoUrl,
    String thumbnailUrl,
    String failureReason,
    Instant createdAt,
    Instant completedAt) {

  public static MontageJobResponse from(MontageJob job) {
    return new MontageJobResponse(
        job.id(),
        job.status(),
        job.weekEnding(),
        job.videoUrl(),
        job.thumbnailUrl(),
        job.failureReason(),
        job.createdAt(),
        job.completedAt());
  }
}
