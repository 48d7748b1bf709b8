package com.scholary.montage.api;

/** Plain message body for errors and acknowledgements. */
public record MessageResponse(String message) {}
