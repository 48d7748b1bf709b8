package com.scholary.montage.service;

import java.time.Instant;

/**
 * An accepted upload waiting for analysis.
 *
 * @param jobId upload job tracking the analysis
 * @param userId owning user
 * @param objectKey key of the stored original
 * @param mediaUrl URL of the stored original
 * @param userPrompt what the user wants from the clip
 * @param capturedAt capture date supplied with the upload
 */
public record ClipUpload(
    String jobId,
    String userId,
    String objectKey,
    String mediaUrl,
    String userPrompt,
    Instant capturedAt) {}
