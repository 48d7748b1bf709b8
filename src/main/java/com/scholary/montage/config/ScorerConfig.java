package com.scholary.montage.config;

import com.scholary.montage.scorer.ScorerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the ScorerProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(ScorerProperties.class)
public class ScorerConfig {}
