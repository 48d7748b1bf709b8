package com.scholary.montage.service;

import com.scholary.montage.clip.WeekBucket;
import com.scholary.montage.config.MontageProperties;
import com.scholary.montage.job.MontageJob;
import com.scholary.montage.job.MontageJobRepository;
import com.scholary.montage.job.MontageJobStatus;
import com.scholary.montage.job.MontageJobUpdate;
import com.scholary.montage.objectstore.ObjectStoreClient;
import com.scholary.montage.selection.SelectionMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Starts montage runs and answers questions about them.
 *
 * <p>Starting a run is a two-step contract: the job record is created synchronously and returned,
 * then the pipeline runs on the montage executor. A watchdog cancels runs that exceed the
 * configured wall-clock limit; the cancelled run still cleans up after itself.
 */
@Service
public class MontageService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MontageService.class);

  private final MontageJobRepository jobRepository;
  private final MontageOrchestrator orchestrator;
  private final ObjectStoreClient objectStore;
  private final WeekBucket weekBucket;
  private final AsyncTaskExecutor executor;
  private final TaskScheduler watchdog;
  private final MontageProperties properties;
  private final Clock clock;

  public MontageService(
      MontageJobRepository jobRepository,
      MontageOrchestrator orchestrator,
      ObjectStoreClient objectStore,
      WeekBucket weekBucket,
      @Qualifier("montageExecutor") AsyncTaskExecutor executor,
      @Qualifier("montageWatchdog") TaskScheduler watchdog,
      MontageProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.orchestrator = orchestrator;
    this.objectStore = objectStore;
    this.weekBucket = weekBucket;
    this.executor = executor;
    this.watchdog = watchdog;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Create a montage job for the user's current week and start it in the background.
   *
   * @param mode selection mode, or null for the configured default
   * @return the job, still in {@code processing} state
   * @throws TaskRejectedException if the executor is saturated; the job is marked failed first
   */
  public MontageJob runMontagePipeline(String userId, SelectionMode mode) {
    SelectionMode effectiveMode = mode != null ? mode : properties.selection().defaultMode();
    LocalDate weekEnding = weekBucket.current();
    MontageJob job = jobRepository.create(userId, weekEnding);
    LOGGER.info(
        "Created montage job {} for user {} (week ending {}, mode {})",
        job.id(),
        userId,
        weekEnding,
        effectiveMode);

    AtomicBoolean started = new AtomicBoolean(false);
    Future<?> run;
    try {
      run =
          executor.submit(
              () -> {
                started.set(true);
                orchestrator.run(job, effectiveMode);
              });
    } catch (TaskRejectedException e) {
      LOGGER.error("Montage executor rejected job {}", job.id(), e);
      markFailed(job.id(), "Server busy, montage could not be started");
      throw e;
    }

    Duration timeout = Duration.ofSeconds(properties.runTimeoutSeconds());
    watchdog.schedule(() -> enforceTimeout(job.id(), run, started), clock.instant().plus(timeout));
    return job;
  }

  public Optional<MontageJob> getJobStatus(String jobId) {
    return jobRepository.findById(jobId);
  }

  /**
   * Delete a montage owned by the user, with its stored video and thumbnail.
   *
   * @return false if there is no such montage for this user
   */
  public boolean deleteMontage(String userId, String montageId) {
    Optional<MontageJob> found = jobRepository.findById(montageId);
    if (found.isEmpty() || !found.get().userId().equals(userId)) {
      return false;
    }
    MontageJob montage = found.get();
    LOGGER.info("Deleting montage {} for user {}", montageId, userId);
    objectStore.keyFromUrl(montage.videoUrl()).ifPresent(objectStore::deleteObject);
    objectStore.keyFromUrl(montage.thumbnailUrl()).ifPresent(objectStore::deleteObject);
    jobRepository.delete(montageId);
    return true;
  }

  private void enforceTimeout(String jobId, Future<?> run, AtomicBoolean started) {
    if (run.isDone()) {
      return;
    }
    LOGGER.warn(
        "Montage job {} exceeded {}s, cancelling", jobId, properties.runTimeoutSeconds());
    run.cancel(true);
    if (!started.get()) {
      // never picked up by a worker, so nothing else will record the outcome
      markFailed(jobId, "Timed out waiting for a worker");
    }
  }

  private void markFailed(String jobId, String reason) {
    try {
      jobRepository
          .findById(jobId)
          .filter(job -> job.status() == MontageJobStatus.PROCESSING)
          .ifPresent(job -> jobRepository.update(jobId, MontageJobUpdate.failed(reason)));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to mark montage job {} as failed", jobId, e);
    }
  }
}
