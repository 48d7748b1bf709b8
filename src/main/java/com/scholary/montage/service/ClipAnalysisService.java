package com.scholary.montage.service;

import com.scholary.montage.clip.Clip;
import com.scholary.montage.clip.ClipRepository;
import com.scholary.montage.clip.WeekBucket;
import com.scholary.montage.config.MontageProperties;
import com.scholary.montage.job.UploadJob;
import com.scholary.montage.job.UploadJobRepository;
import com.scholary.montage.logging.StructuredLogger;
import com.scholary.montage.objectstore.ObjectKeys;
import com.scholary.montage.objectstore.ObjectStoreClient;
import com.scholary.montage.profile.UploadCounterRepository;
import com.scholary.montage.scorer.ScorerService;
import com.scholary.montage.scorer.SegmentAnalysis;
import com.scholary.montage.selection.ScoreWeights;
import com.scholary.montage.transcode.Transcoder;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Background analysis of one uploaded video.
 *
 * <p>Downloads the original, stores a thumbnail, analyzes a compressed copy with the scorer and
 * saves the resulting {@link Clip}. The upload job ends {@code completed} with the clip id or
 * {@code failed} with the error. Scorer failures do not fail the job: the scorer falls back to a
 * default segment instead.
 */
@Service
public class ClipAnalysisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipAnalysisService.class);

  private final ObjectStoreClient objectStore;
  private final Transcoder transcoder;
  private final ScorerService scorer;
  private final ClipRepository clipRepository;
  private final UploadJobRepository uploadJobs;
  private final UploadCounterRepository uploadCounters;
  private final WeekBucket weekBucket;
  private final MontageProperties properties;
  private final Clock clock;

  public ClipAnalysisService(
      ObjectStoreClient objectStore,
      Transcoder transcoder,
      ScorerService scorer,
      ClipRepository clipRepository,
      UploadJobRepository uploadJobs,
      UploadCounterRepository uploadCounters,
      WeekBucket weekBucket,
      MontageProperties properties,
      Clock clock) {
    this.objectStore = objectStore;
    this.transcoder = transcoder;
    this.scorer = scorer;
    this.clipRepository = clipRepository;
    this.uploadJobs = uploadJobs;
    this.uploadCounters = uploadCounters;
    this.weekBucket = weekBucket;
    this.properties = properties;
    this.clock = clock;
  }

  /** Analyze an upload. Never throws; the outcome is recorded on the upload job. */
  public void analyze(ClipUpload upload) {
    StructuredLogger.setJobContext(upload.jobId(), upload.userId(), null);
    WorkingDirectory workDir = null;
    try {
      LOGGER.info("Starting analysis of {}", upload.objectKey());
      workDir = WorkingDirectory.create(Path.of(properties.workDir()), upload.userId(), clock);
      Clip clip = process(upload, workDir);
      complete(upload.jobId(), clip.id());

    } catch (RuntimeException e) {
      LOGGER.error("Analysis of {} failed", upload.objectKey(), e);
      failJob(upload.jobId(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());

    } finally {
      if (workDir != null) {
        workDir.close();
      }
      StructuredLogger.clearJobContext();
    }
  }

  private Clip process(ClipUpload upload, WorkingDirectory workDir) {
    String unique = clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    Path original = workDir.resolve(unique + "_original.mp4");
    Path thumbnail = workDir.resolve(unique + "_thumb.jpg");
    Path compressed = workDir.resolve(unique + "_compressed.mp4");

    objectStore.downloadToFile(upload.objectKey(), original);
    transcoder.thumbnail(original, thumbnail);
    transcoder.compress(original, compressed);

    String thumbnailUrl =
        objectStore.uploadFile(
            ObjectKeys.clipThumbnail(upload.userId(), unique), thumbnail, "image/jpeg");

    Optional<Double> duration = transcoder.probeDuration(compressed);
    SegmentAnalysis analysis =
        scorer.analyzeSingleClip(compressed, upload.userPrompt(), duration.orElse(null));
    if (analysis.fallback()) {
      LOGGER.warn("Using fallback segment for {}", upload.objectKey());
    }

    Clip clip =
        new Clip(
            UUID.randomUUID().toString(),
            upload.userId(),
            upload.mediaUrl(),
            thumbnailUrl,
            analysis.startSec(),
            analysis.endSec(),
            analysis.description(),
            analysis.scores(),
            ScoreWeights.DEFAULT.composite(analysis.scores()),
            upload.capturedAt(),
            weekBucket.current());
    clipRepository.save(clip);
    LOGGER.info(
        "Saved clip {}: [{}, {}]s score={}",
        clip.id(),
        clip.startSec(),
        clip.endSec(),
        clip.score());

    try {
      int count = uploadCounters.increment(upload.userId());
      LOGGER.info("Weekly upload count for user {} is now {}", upload.userId(), count);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to increment upload count for user {}", upload.userId(), e);
    }
    return clip;
  }

  private void complete(String jobId, String clipId) {
    uploadJobs
        .findById(jobId)
        .ifPresent(job -> uploadJobs.save(job.completed(clipId, clock.instant())));
  }

  private void failJob(String jobId, String error) {
    try {
      Optional<UploadJob> job = uploadJobs.findById(jobId);
      job.ifPresent(j -> uploadJobs.save(j.failed(error, clock.instant())));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to mark upload job {} as failed", jobId, e);
    }
  }
}
