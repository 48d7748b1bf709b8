package com.scholary.montage.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.montage.clip.Clip;
import com.scholary.montage.clip.ClipRepository;
import com.scholary.montage.clip.ClipScores;
import com.scholary.montage.config.MontageProperties;
import com.scholary.montage.job.InMemoryMontageJobRepository;
import com.scholary.montage.job.MontageJob;
import com.scholary.montage.job.MontageJobStatus;
import com.scholary.montage.objectstore.ObjectStoreClient;
import com.scholary.montage.objectstore.ObjectStoreException;
import com.scholary.montage.profile.UploadCounterRepository;
import com.scholary.montage.scorer.ScorerException;
import com.scholary.montage.scorer.ScorerService;
import com.scholary.montage.selection.CandidateScorer;
import com.scholary.montage.selection.FlatPoolPruningStrategy;
import com.scholary.montage.selection.PerSourceThresholdStrategy;
import com.scholary.montage.selection.ScoreWeights;
import com.scholary.montage.selection.SelectionConstraints;
import com.scholary.montage.selection.SelectionEngine;
import com.scholary.montage.selection.SelectionMode;
import com.scholary.montage.selection.ThresholdSchedule;
import com.scholary.montage.transcode.TranscodeException;
import com.scholary.montage.transcode.Transcoder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

/** Pipeline tests with real selection and job store, and fake storage, scorer and transcoder. */
@ExtendWith(MockitoExtension.class)
class MontageOrchestratorTest {

  private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
  private static final LocalDate WEEK = LocalDate.of(2026, 10, 18);
  private static final String USER = "user-1";

  @Mock private ClipRepository clipRepository;
  @Mock private UploadCounterRepository uploadCounters;
  @Mock private ScorerService scorer;
  @Mock private Transcoder transcoder;
  @Mock private ObjectStoreClient objectStore;

  @TempDir Path workRoot;

  private InMemoryMontageJobRepository jobRepository;
  private MontageOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    jobRepository = spy(new InMemoryMontageJobRepository(clock, 100, 30));

    CandidateScorer candidateScorer = new CandidateScorer(ScoreWeights.DEFAULT, 12.0, 0.9);
    SelectionEngine engine =
        new SelectionEngine(
            List.of(
                new FlatPoolPruningStrategy(candidateScorer),
                new PerSourceThresholdStrategy(
                    candidateScorer, new ThresholdSchedule(0.8, 0.1, 0.3))));
    MontageProperties properties =
        new MontageProperties(
            workRoot.toString(),
            "UTC",
            new MontageProperties.Selection(
                60, 90, 12, 0.9, 0.8, 0.1, 0.3, SelectionMode.FLAT_POOL),
            2,
            600,
            2,
            10);

    orchestrator =
        new MontageOrchestrator(
            clipRepository,
            jobRepository,
            uploadCounters,
            scorer,
            engine,
            new SelectionConstraints(60, 90),
            transcoder,
            objectStore,
            properties,
            clock);

    lenient()
        .when(objectStore.keyFromUrl(anyString()))
        .thenAnswer(
            invocation -> {
              String url = invocation.getArgument(0);
              return Optional.of(url.substring(url.indexOf("clips/")));
            });
    lenient()
        .when(objectStore.uploadFile(anyString(), any(Path.class), anyString()))
        .thenAnswer(invocation -> "http://store/highlights/" + invocation.getArgument(0));
    lenient()
        .when(transcoder.normalize(any(Path.class), anyDouble(), anyDouble(), any(Path.class)))
        .thenAnswer(invocation -> touch(invocation.getArgument(3)));
    lenient()
        .when(transcoder.concatenate(anyList(), any(Path.class)))
        .thenAnswer(invocation -> touch(invocation.getArgument(1)));
    lenient()
        .when(transcoder.thumbnail(any(Path.class), any(Path.class)))
        .thenAnswer(invocation -> touch(invocation.getArgument(1)));
    lenient().when(scorer.suggestRedundant(anyList())).thenReturn(List.of());
  }

  @Test
  void run_publishesMontageAndResetsCounter() throws IOException {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
    assertThat(result.videoUrl()).startsWith("http://store/highlights/montages/user-1/2026-10-18/");
    assertThat(result.thumbnailUrl())
        .startsWith("http://store/highlights/montages/thumbnails/user-1/2026-10-18/");
    assertThat(result.completedAt()).isEqualTo(NOW);
    assertThat(jobRepository.findById(result.id())).contains(result);
    verify(uploadCounters).reset(USER);
    assertThat(workRootEntries()).isEmpty();
  }

  @Test
  void run_concatenatesInChronologicalOrder() {
    List<Clip> pool = new ArrayList<>(fiveClips());
    Collections.reverse(pool);
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(pool);

    orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Path>> inputs = ArgumentCaptor.forClass(List.class);
    verify(transcoder).concatenate(inputs.capture(), any(Path.class));
    assertThat(inputs.getValue())
        .extracting(path -> path.getFileName().toString())
        .containsExactly(
            "0_normalized.ts",
            "1_normalized.ts",
            "2_normalized.ts",
            "3_normalized.ts",
            "4_normalized.ts");
    ArgumentCaptor<Path> sources = ArgumentCaptor.forClass(Path.class);
    verify(objectStore).downloadToFile(eq("clips/c1.mp4"), sources.capture());
    assertThat(sources.getValue().getFileName().toString()).isEqualTo("0_source.mp4");
  }

  @Test
  void run_failsWhenPoolIsEmpty() throws IOException {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(List.of());

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.FAILED);
    assertThat(result.failureReason()).containsIgnoringCase("no clips");
    verifyNoInteractions(transcoder);
    verify(uploadCounters, never()).reset(anyString());
    assertThat(workRootEntries()).isEmpty();
  }

  @Test
  void run_skipsClipThatCannotBeDownloaded() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    lenient()
        .doThrow(new ObjectStoreException("Object not found"))
        .when(objectStore)
        .downloadToFile(eq("clips/c3.mp4"), any(Path.class));

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Path>> inputs = ArgumentCaptor.forClass(List.class);
    verify(transcoder).concatenate(inputs.capture(), any(Path.class));
    assertThat(inputs.getValue()).hasSize(4);
  }

  @Test
  void run_skipsClipThatFailsToTranscode() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    doThrow(new TranscodeException("ffmpeg exited with code 1"))
        .when(transcoder)
        .normalize(
            argThat(path -> path != null && path.getFileName().toString().equals("2_source.mp4")),
            anyDouble(),
            anyDouble(),
            any(Path.class));

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Path>> inputs = ArgumentCaptor.forClass(List.class);
    verify(transcoder).concatenate(inputs.capture(), any(Path.class));
    assertThat(inputs.getValue())
        .extracting(path -> path.getFileName().toString())
        .containsExactly(
            "0_normalized.ts", "1_normalized.ts", "3_normalized.ts", "4_normalized.ts");
  }

  @Test
  void run_failsWhenNoClipCanBeNormalized() throws IOException {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    doThrow(new TranscodeException("ffmpeg exited with code 1"))
        .when(transcoder)
        .normalize(any(Path.class), anyDouble(), anyDouble(), any(Path.class));

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.FAILED);
    assertThat(result.failureReason()).isEqualTo("No clips could be processed for the montage");
    verify(transcoder, never()).concatenate(anyList(), any(Path.class));
    assertThat(workRootEntries()).isEmpty();
  }

  @Test
  void run_toleratesScorerFailureForHints() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    doThrow(new ScorerException("unavailable")).when(scorer).suggestRedundant(anyList());

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
  }

  @Test
  void run_appliesRedundancyHintsBeforeScorePruning() {
    // 5 x 20s = 100s; dropping the hinted clip gets under 90s.
    List<Clip> pool = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      pool.add(clip("c" + i, 20, 0.9, i));
    }
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(pool);
    doReturn(List.of(1)).when(scorer).suggestRedundant(anyList());

    orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    verify(objectStore, never()).downloadToFile(eq("clips/c2.mp4"), any(Path.class));
    verify(objectStore).downloadToFile(eq("clips/c5.mp4"), any(Path.class));
  }

  @Test
  void run_perSourceModeDoesNotAskForHints() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());

    MontageJob result = orchestrator.run(newJob(), SelectionMode.PER_SOURCE);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
    verify(scorer, never()).suggestRedundant(anyList());
  }

  @Test
  void run_counterResetFailureStillCompletes() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    doThrow(new IllegalStateException("profile store down")).when(uploadCounters).reset(USER);

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
  }

  @Test
  void run_publishFailureFailsJob() throws IOException {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    doThrow(new ObjectStoreException("Access denied"))
        .when(objectStore)
        .uploadFile(anyString(), any(Path.class), eq("video/mp4"));

    MontageJob result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);

    assertThat(result.status()).isEqualTo(MontageJobStatus.FAILED);
    assertThat(result.failureReason()).isEqualTo("publish failed: Access denied");
    verify(uploadCounters, never()).reset(anyString());
    assertThat(workRootEntries()).isEmpty();
  }

  @Test
  void run_normalizeWorkersLogWithJobContext() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    List<String> workerJobIds = new CopyOnWriteArrayList<>();
    doAnswer(
            invocation -> {
              workerJobIds.add(String.valueOf(MDC.get("jobId")));
              return touch(invocation.getArgument(3));
            })
        .when(transcoder)
        .normalize(any(Path.class), anyDouble(), anyDouble(), any(Path.class));

    MontageJob job = newJob();
    orchestrator.run(job, SelectionMode.FLAT_POOL);

    assertThat(workerJobIds).hasSize(5).containsOnly(job.id());
  }

  @Test
  void run_interruptedMidStageFailsAndCleansUp() throws Exception {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    CountDownLatch downloadStarted = new CountDownLatch(1);
    AtomicBoolean workerFinished = new AtomicBoolean(false);
    doAnswer(
            invocation -> {
              downloadStarted.countDown();
              try {
                Thread.sleep(30_000);
                return null;
              } catch (InterruptedException e) {
                Thread.sleep(200);
                workerFinished.set(true);
                throw new ObjectStoreException("Download interrupted");
              }
            })
        .when(objectStore)
        .downloadToFile(anyString(), any(Path.class));

    MontageJob job = newJob();
    AtomicReference<MontageJob> result = new AtomicReference<>();
    Thread runner = new Thread(() -> result.set(orchestrator.run(job, SelectionMode.FLAT_POOL)));
    runner.start();
    assertThat(downloadStarted.await(10, TimeUnit.SECONDS)).isTrue();

    runner.interrupt();
    runner.join(TimeUnit.SECONDS.toMillis(20));

    assertThat(runner.isAlive()).isFalse();
    assertThat(workerFinished).isTrue();
    assertThat(result.get().status()).isEqualTo(MontageJobStatus.FAILED);
    assertThat(result.get().failureReason()).isEqualTo("Run timed out or was cancelled");
    verify(transcoder, never()).concatenate(anyList(), any(Path.class));
    assertThat(workRootEntries()).isEmpty();
  }

  @Test
  void run_interruptAfterFinalizeKeepsJobComplete() {
    when(clipRepository.findByUserAndWeek(USER, WEEK)).thenReturn(fiveClips());
    AtomicBoolean counterReset = new AtomicBoolean(false);
    doAnswer(
            invocation -> {
              Thread.currentThread().interrupt();
              return invocation.callRealMethod();
            })
        .when(jobRepository)
        .update(anyString(), argThat(update -> update.status() == MontageJobStatus.COMPLETE));
    doAnswer(
            invocation -> {
              counterReset.set(true);
              return null;
            })
        .when(uploadCounters)
        .reset(USER);

    MontageJob result;
    try {
      result = orchestrator.run(newJob(), SelectionMode.FLAT_POOL);
    } finally {
      Thread.interrupted();
    }

    assertThat(result.status()).isEqualTo(MontageJobStatus.COMPLETE);
    assertThat(counterReset).isTrue();
    verify(jobRepository, never())
        .update(anyString(), argThat(update -> update.status() == MontageJobStatus.FAILED));
  }

  private MontageJob newJob() {
    return jobRepository.create(USER, WEEK);
  }

  /** Five 15 second clips, 75 seconds in total, so nothing is pruned. */
  private static List<Clip> fiveClips() {
    List<Clip> clips = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      clips.add(clip("c" + i, 15, 0.5 + i / 10.0, i));
    }
    return clips;
  }

  private static Clip clip(String id, double durationSec, double relevance, int minute) {
    ClipScores scores = new ClipScores(relevance, 0.5, 0.5);
    return new Clip(
        id,
        USER,
        "http://store/highlights/clips/" + id + ".mp4",
        null,
        0.0,
        durationSec,
        "clip " + id,
        scores,
        ScoreWeights.DEFAULT.composite(scores),
        Instant.parse("2026-10-12T08:00:00Z").plusSeconds(60L * minute),
        WEEK);
  }

  private static Path touch(Path file) throws IOException {
    Files.writeString(file, "data");
    return file;
  }

  private List<Path> workRootEntries() throws IOException {
    try (Stream<Path> entries = Files.list(workRoot)) {
      return entries.toList();
    }
  }
}
