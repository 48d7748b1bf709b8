package com.scholary.montage.api;

/**
 * Response for an accepted clip upload.
 *
 * <p>The job id is polled for the analysis result.
 */
public record ClipUploadResponse(String jobId, String uploadUrl, String message) {}
