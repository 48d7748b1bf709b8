package com.scholary.montage.config;

import com.scholary.montage.transcode.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the FfmpegProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class FfmpegConfig {}
