package com.scholary.montage.scorer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the scoring service client.
 *
 * <p>Backoff before retry {@code n} is {@code 2^n * backoffBaseMillis} plus up to {@code
 * backoffJitterMillis} of random jitter.
 */
@ConfigurationProperties(prefix = "scorer")
@Validated
public record ScorerProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxAttempts,
    @PositiveOrZero long backoffBaseMillis,
    @PositiveOrZero long backoffJitterMillis,
    @Positive int maxConcurrentCalls,
    @Positive double fallbackMaxSeconds,
    @NotBlank String defaultIntent) {}
