package com.scholary.montage.config;

import com.scholary.montage.selection.CandidateScorer;
import com.scholary.montage.selection.FlatPoolPruningStrategy;
import com.scholary.montage.selection.PerSourceThresholdStrategy;
import com.scholary.montage.selection.ScoreWeights;
import com.scholary.montage.selection.SelectionConstraints;
import com.scholary.montage.selection.SelectionEngine;
import com.scholary.montage.selection.ThresholdSchedule;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for montage selection.
 *
 * <p>The selection classes are plain Java; this wires them from {@link MontageProperties}.
 */
@Configuration
@EnableConfigurationProperties(MontageProperties.class)
public class MontageConfig {

  @Bean
  public ZoneId montageZone(MontageProperties properties) {
    return ZoneId.of(properties.zone());
  }

  @Bean
  public SelectionConstraints selectionConstraints(MontageProperties properties) {
    return new SelectionConstraints(
        properties.selection().minDurationSeconds(), properties.selection().maxDurationSeconds());
  }

  @Bean
  public SelectionEngine selectionEngine(MontageProperties properties) {
    MontageProperties.Selection selection = properties.selection();
    CandidateScorer scorer =
        new CandidateScorer(
            ScoreWeights.DEFAULT,
            selection.longClipThresholdSeconds(),
            selection.longClipPenalty());
    ThresholdSchedule schedule =
        new ThresholdSchedule(
            selection.thresholdStart(), selection.thresholdStep(), selection.thresholdFloor());
    return new SelectionEngine(
        List.of(
            new FlatPoolPruningStrategy(scorer), new PerSourceThresholdStrategy(scorer, schedule)));
  }
}
