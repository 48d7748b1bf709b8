package com.scholary.montage.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle of a single-clip analysis job. */
public enum UploadJobStatus {
  PROCESSING,
  COMPLETED,
  FAILED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
