package com.scholary.montage.service;

import com.scholary.montage.clip.Clip;
import com.scholary.montage.clip.ClipRepository;
import com.scholary.montage.clip.WeekBucket;
import com.scholary.montage.job.UploadJob;
import com.scholary.montage.job.UploadJobRepository;
import com.scholary.montage.objectstore.ObjectKeys;
import com.scholary.montage.objectstore.ObjectStoreClient;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/** Clip uploads, upload status and clip deletion. */
@Service
public class ClipService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipService.class);

  private final ObjectStoreClient objectStore;
  private final UploadJobRepository uploadJobs;
  private final ClipRepository clipRepository;
  private final ClipAnalysisService analysisService;
  private final WeekBucket weekBucket;
  private final AsyncTaskExecutor executor;
  private final Clock clock;

  public ClipService(
      ObjectStoreClient objectStore,
      UploadJobRepository uploadJobs,
      ClipRepository clipRepository,
      ClipAnalysisService analysisService,
      WeekBucket weekBucket,
      @Qualifier("analysisExecutor") AsyncTaskExecutor executor,
      Clock clock) {
    this.objectStore = objectStore;
    this.uploadJobs = uploadJobs;
    this.clipRepository = clipRepository;
    this.analysisService = analysisService;
    this.weekBucket = weekBucket;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Store an uploaded video and start analysing it in the background.
   *
   * @return the upload job, in {@code processing} state
   * @throws com.scholary.montage.objectstore.ObjectStoreException if the video cannot be stored
   * @throws TaskRejectedException if the analysis executor is saturated
   */
  public UploadJob acceptUpload(
      String userId,
      String filename,
      String contentType,
      byte[] video,
      String userPrompt,
      Instant capturedAt) {
    String unique = clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    String key = ObjectKeys.clip(userId, weekBucket.current(), unique, filename);
    String mediaUrl =
        objectStore.uploadBytes(key, video, contentType == null ? "video/mp4" : contentType);

    UploadJob job =
        UploadJob.processing(
            UUID.randomUUID().toString(), userId, mediaUrl, filename, clock.instant());
    uploadJobs.save(job);
    LOGGER.info("Accepted upload {} as job {}", key, job.jobId());

    ClipUpload upload =
        new ClipUpload(job.jobId(), userId, key, mediaUrl, userPrompt, capturedAt);
    try {
      executor.execute(() -> analysisService.analyze(upload));
    } catch (TaskRejectedException e) {
      LOGGER.error("Analysis executor rejected job {}", job.jobId(), e);
      uploadJobs.save(job.failed("Server busy, analysis could not be started", clock.instant()));
      throw e;
    }
    return job;
  }

  public Optional<UploadJob> getUploadJob(String jobId) {
    return uploadJobs.findById(jobId);
  }

  public Optional<Clip> getClip(String clipId) {
    return clipRepository.findById(clipId);
  }

  /**
   * Delete a clip owned by the user, with its stored video and thumbnail.
   *
   * @return false if there is no such clip for this user
   */
  public boolean deleteClip(String userId, String clipId) {
    Optional<Clip> found = clipRepository.findById(clipId);
    if (found.isEmpty() || !found.get().userId().equals(userId)) {
      return false;
    }
    Clip clip = found.get();
    LOGGER.info("Deleting clip {} for user {}", clipId, userId);
    objectStore.keyFromUrl(clip.mediaUrl()).ifPresent(objectStore::deleteObject);
    objectStore.keyFromUrl(clip.thumbnailUrl()).ifPresent(objectStore::deleteObject);
    clipRepository.delete(clipId);
    return true;
  }
}
