package com.scholary.montage.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.montage.job.UploadJobStatus;
import java.time.Instant;

/**
 * Response for an upload job status query.
 *
 * <p>Includes the clip once analysis has completed and the error once it has failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClipJobStatusResponse(
    String jobId,
    UploadJobStatus status,
    String uploadUrl,
    Instant updatedAt,
    ClipResponse clip,
    String error) {}
