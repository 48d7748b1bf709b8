package com.scholary.montage.service;

import com.scholary.montage.clip.Clip;
import com.scholary.montage.clip.ClipRepository;
import com.scholary.montage.config.MontageProperties;
import com.scholary.montage.job.MontageJob;
import com.scholary.montage.job.MontageJobRepository;
import com.scholary.montage.job.MontageJobUpdate;
import com.scholary.montage.logging.StructuredLogger;
import com.scholary.montage.objectstore.ObjectKeys;
import com.scholary.montage.objectstore.ObjectStoreClient;
import com.scholary.montage.objectstore.ObjectStoreException;
import com.scholary.montage.profile.UploadCounterRepository;
import com.scholary.montage.scorer.RedundancyCandidate;
import com.scholary.montage.scorer.ScorerService;
import com.scholary.montage.selection.Selection;
import com.scholary.montage.selection.SelectionConstraints;
import com.scholary.montage.selection.SelectionContext;
import com.scholary.montage.selection.SelectionEngine;
import com.scholary.montage.selection.SelectionMode;
import com.scholary.montage.transcode.TranscodeException;
import com.scholary.montage.transcode.Transcoder;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Runs one montage job from candidate pool to published video.
 *
 * <p>Stages run in {@link PipelineStage} order:
 *
 * <ol>
 *   <li>Fetch the user's clips for the job's week. An empty pool fails the job.
 *   <li>Ask the scorer which clips are redundant. Failure means no hints.
 *   <li>Select clips with the {@link SelectionEngine}.
 *   <li>Download and normalize each selected clip, a few at a time. Clips that cannot be resolved
 *       or transcoded are skipped; the job fails only if none are left.
 *   <li>Concatenate the normalized clips in timeline order and grab a thumbnail.
 *   <li>Upload the video and thumbnail.
 *   <li>Mark the job complete, then reset the weekly upload counter (best effort).
 * </ol>
 *
 * <p>{@link #run} never throws: every outcome ends up on the job record. The working directory is
 * removed on every exit path, after the failure has been recorded.
 */
@Component
public class MontageOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MontageOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);
  private static final long WORKER_STOP_TIMEOUT_SECONDS = 10;

  private final ClipRepository clipRepository;
  private final MontageJobRepository jobRepository;
  private final UploadCounterRepository uploadCounters;
  private final ScorerService scorer;
  private final SelectionEngine selectionEngine;
  private final SelectionConstraints constraints;
  private final Transcoder transcoder;
  private final ObjectStoreClient objectStore;
  private final MontageProperties properties;
  private final Clock clock;

  public MontageOrchestrator(
      ClipRepository clipRepository,
      MontageJobRepository jobRepository,
      UploadCounterRepository uploadCounters,
      ScorerService scorer,
      SelectionEngine selectionEngine,
      SelectionConstraints constraints,
      Transcoder transcoder,
      ObjectStoreClient objectStore,
      MontageProperties properties,
      Clock clock) {
    this.clipRepository = clipRepository;
    this.jobRepository = jobRepository;
    this.uploadCounters = uploadCounters;
    this.scorer = scorer;
    this.selectionEngine = selectionEngine;
    this.constraints = constraints;
    this.transcoder = transcoder;
    this.objectStore = objectStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Run the pipeline for a job created in {@code processing} state.
   *
   * @return the job in its final state
   */
  public MontageJob run(MontageJob job, SelectionMode mode) {
    long startMs = clock.millis();
    StructuredLogger.setJobContext(job.id(), job.userId(), job.weekEnding());
    WorkingDirectory workDir = null;
    try {
      LOGGER.info(
          "Starting montage run: job={}, user={}, week={}, mode={}",
          job.id(),
          job.userId(),
          job.weekEnding(),
          mode);
      workDir = WorkingDirectory.create(Path.of(properties.workDir()), job.userId(), clock);
      MontageJob completed = runStages(job, mode, workDir);
      STRUCTURED_LOGGER.logJobFinished(
          job.id(), completed.status().wireName(), clock.millis() - startMs, null);
      return completed;

    } catch (MontagePipelineException e) {
      return fail(job, e.getReason(), startMs);

    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure in montage run {}", job.id(), e);
      return fail(job, "Unexpected error: " + e.getMessage(), startMs);

    } finally {
      if (workDir != null) {
        workDir.close();
      }
      StructuredLogger.clearJobContext();
    }
  }

  private MontageJob runStages(MontageJob job, SelectionMode mode, WorkingDirectory workDir) {
    List<Clip> pool =
        stage(
            PipelineStage.FETCH,
            () -> clipRepository.findByUserAndWeek(job.userId(), job.weekEnding()),
            null);
    if (pool.isEmpty()) {
      throw new MontagePipelineException(
          PipelineStage.FETCH, "No clips found for week ending " + job.weekEnding());
    }
    LOGGER.info("Fetched {} candidate clips", pool.size());

    List<Integer> hints =
        mode == SelectionMode.FLAT_POOL
            ? stage(PipelineStage.REDUNDANCY_HINTS, () -> redundancyHints(pool), List.of())
            : List.of();

    Selection selection =
        stage(
            PipelineStage.SELECT,
            () -> selectionEngine.select(mode, new SelectionContext(pool, constraints, hints)),
            null);
    if (selection.isEmpty()) {
      throw new MontagePipelineException(PipelineStage.SELECT, "Selection is empty");
    }
    STRUCTURED_LOGGER.logSelection(
        mode.name(),
        pool.size(),
        selection.clips().size(),
        selection.diagnostics().initialDurationSec(),
        selection.totalDurationSec());

    List<Path> normalized =
        stage(PipelineStage.NORMALIZE, () -> normalizeAll(selection.clips(), workDir), null);
    if (normalized.isEmpty()) {
      throw new MontagePipelineException(
          PipelineStage.NORMALIZE, "No clips could be processed for the montage");
    }

    Path montage = workDir.resolve("final_montage.mp4");
    Path thumbnail = workDir.resolve("final_montage_thumb.jpg");
    stage(
        PipelineStage.ASSEMBLE,
        () -> {
          transcoder.concatenate(normalized, montage);
          return transcoder.thumbnail(montage, thumbnail);
        },
        null);

    String unique = clock.millis() + "-" + ThreadLocalRandom.current().nextInt(1_000_000_000);
    String videoUrl =
        stage(
            PipelineStage.PUBLISH,
            () ->
                objectStore.uploadFile(
                    ObjectKeys.montage(job.userId(), job.weekEnding(), unique),
                    montage,
                    "video/mp4"),
            null);
    String thumbnailUrl =
        stage(
            PipelineStage.PUBLISH,
            () ->
                objectStore.uploadFile(
                    ObjectKeys.montageThumbnail(job.userId(), job.weekEnding(), unique),
                    thumbnail,
                    "image/jpeg"),
            null);
    LOGGER.info("Montage published to {}", videoUrl);

    MontageJob completed =
        stage(
            PipelineStage.FINALIZE,
            () ->
                jobRepository.update(
                    job.id(), MontageJobUpdate.complete(videoUrl, thumbnailUrl, clock.instant())),
            null);

    stage(
        PipelineStage.RESET_UPLOAD_COUNTER,
        () -> {
          uploadCounters.reset(job.userId());
          return Boolean.TRUE;
        },
        Boolean.FALSE);

    return completed;
  }

  private List<Integer> redundancyHints(List<Clip> pool) {
    List<RedundancyCandidate> candidates = new ArrayList<>(pool.size());
    for (int i = 0; i < pool.size(); i++) {
      candidates.add(new RedundancyCandidate(i, pool.get(i).description()));
    }
    return scorer.suggestRedundant(candidates);
  }

  /**
   * Normalize the selected clips with bounded parallelism.
   *
   * @return normalized files in selection order, without the clips that were skipped
   */
  private List<Path> normalizeAll(List<Clip> clips, WorkingDirectory workDir) {
    ExecutorService pool =
        Executors.newFixedThreadPool(Math.min(properties.normalizeParallelism(), clips.size()));
    Map<String, String> logContext = MDC.getCopyOfContextMap();
    try {
      List<Future<Optional<Path>>> futures = new ArrayList<>(clips.size());
      for (int i = 0; i < clips.size(); i++) {
        int position = i;
        Clip clip = clips.get(i);
        futures.add(
            pool.submit(
                () -> {
                  if (logContext != null) {
                    MDC.setContextMap(logContext);
                  }
                  try {
                    return normalizeClip(position, clip, workDir);
                  } finally {
                    MDC.clear();
                  }
                }));
      }

      List<Path> normalized = new ArrayList<>(clips.size());
      for (int i = 0; i < futures.size(); i++) {
        try {
          futures.get(i).get().ifPresent(normalized::add);
        } catch (ExecutionException e) {
          STRUCTURED_LOGGER.logClipSkipped(
              i, clips.get(i).id(), String.valueOf(e.getCause().getMessage()));
        }
      }
      LOGGER.info("Normalized {} of {} selected clips", normalized.size(), clips.size());
      return normalized;

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MontagePipelineException(
          PipelineStage.NORMALIZE, "Run timed out or was cancelled", e);
    } finally {
      stopWorkers(pool);
    }
  }

  /**
   * Stop the normalize workers and wait for them to exit, so none is still writing into the working
   * directory when it is removed. The caller's interrupt status is preserved.
   */
  private static void stopWorkers(ExecutorService pool) {
    pool.shutdownNow();
    boolean interrupted = Thread.interrupted();
    try {
      if (!pool.awaitTermination(WORKER_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Normalize workers still running after {}s", WORKER_STOP_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      interrupted = true;
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private Optional<Path> normalizeClip(int position, Clip clip, WorkingDirectory workDir) {
    Optional<String> key = objectStore.keyFromUrl(clip.mediaUrl());
    if (key.isEmpty()) {
      STRUCTURED_LOGGER.logClipSkipped(position, clip.id(), "media reference cannot be resolved");
      return Optional.empty();
    }
    Path source = workDir.resolve(position + "_source" + extension(key.get()));
    Path output = workDir.resolve(position + "_normalized.ts");
    try {
      objectStore.downloadToFile(key.get(), source);
      transcoder.normalize(source, clip.startSec(), clip.endSec(), output);
      return Optional.of(output);
    } catch (ObjectStoreException | TranscodeException e) {
      STRUCTURED_LOGGER.logClipSkipped(position, clip.id(), e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Run one stage with logging.
   *
   * <p>A failing fatal stage is rethrown as a {@link MontagePipelineException}; a failing non-fatal
   * stage yields {@code fallback}. An interrupted thread fails a cancellable stage regardless, since
   * that is how the watchdog stops an overdue run.
   */
  private <T> T stage(PipelineStage stage, Supplier<T> body, T fallback) {
    long startMs = clock.millis();
    STRUCTURED_LOGGER.logStageStarted(stage.name());
    try {
      T result = body.get();
      if (cancelled(stage)) {
        throw new MontagePipelineException(stage, "Run timed out or was cancelled");
      }
      STRUCTURED_LOGGER.logStageFinished(stage.name(), clock.millis() - startMs);
      return result;

    } catch (MontagePipelineException e) {
      STRUCTURED_LOGGER.logStageFailed(stage.name(), true, e.getClass().getSimpleName(), e.getReason());
      throw e;

    } catch (RuntimeException e) {
      boolean cancelled = cancelled(stage);
      STRUCTURED_LOGGER.logStageFailed(
          stage.name(), stage.isFatal() || cancelled, e.getClass().getSimpleName(), e.getMessage());
      if (stage.isFatal() || cancelled) {
        String reason = cancelled ? "Run timed out or was cancelled" : describe(stage, e);
        throw new MontagePipelineException(stage, reason, e);
      }
      return fallback;
    }
  }

  private static boolean cancelled(PipelineStage stage) {
    return stage.isCancellable() && Thread.currentThread().isInterrupted();
  }

  private MontageJob fail(MontageJob job, String reason, long startMs) {
    STRUCTURED_LOGGER.logJobFinished(job.id(), "failed", clock.millis() - startMs, reason);
    try {
      return jobRepository.update(job.id(), MontageJobUpdate.failed(reason));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to mark montage job {} as failed", job.id(), e);
      return jobRepository.findById(job.id()).orElse(job);
    }
  }

  private static String describe(PipelineStage stage, RuntimeException e) {
    String stageName = stage.name().toLowerCase().replace('_', ' ');
    return e.getMessage() == null
        ? stageName + " failed"
        : stageName + " failed: " + e.getMessage();
  }

  private static String extension(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    return dot > slash ? key.substring(dot) : ".mp4";
  }
}
