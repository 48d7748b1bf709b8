package com.scholary.montage.config;

import com.scholary.montage.selection.SelectionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for montage assembly.
 *
 * <p>These map to the "montage.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "montage")
@Validated
public record MontageProperties(
    @NotBlank String workDir,
    @NotBlank String zone,
    @NotNull @Valid Selection selection,
    @Positive int normalizeParallelism,
    @Positive long runTimeoutSeconds,
    @Positive int executorThreads,
    @PositiveOrZero int executorQueueSize) {

  /** Selection engine tuning. */
  public record Selection(
      @PositiveOrZero double minDurationSeconds,
      @Positive double maxDurationSeconds,
      @Positive double longClipThresholdSeconds,
      @Positive double longClipPenalty,
      double thresholdStart,
      @Positive double thresholdStep,
      double thresholdFloor,
      @NotNull SelectionMode defaultMode) {}
}
