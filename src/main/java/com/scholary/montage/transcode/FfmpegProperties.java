package com.scholary.montage.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>{@code width} x {@code height} is the canonical montage frame; every clip is scaled and
 * padded into it so the concatenated output has a single resolution.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int width,
    @Positive int height,
    @Positive int frameRate,
    @PositiveOrZero int crf,
    @NotBlank String preset,
    @PositiveOrZero double thumbnailOffsetSeconds,
    @Positive int compressHeight,
    @PositiveOrZero int compressCrf,
    @Positive long processTimeoutSeconds) {}
