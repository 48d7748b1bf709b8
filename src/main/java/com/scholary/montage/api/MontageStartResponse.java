package com.scholary.montage.api;

/** Response for a started montage run. */
public record MontageStartResponse(String jobId, String message) {}
