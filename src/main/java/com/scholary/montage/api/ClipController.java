package com.scholary.montage.api;

import com.scholary.montage.job.UploadJob;
import com.scholary.montage.job.UploadJobStatus;
import com.scholary.montage.service.ClipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for clip uploads.
 *
 * <p>Uploads are acknowledged with 202 as soon as the video is stored; analysis runs in the
 * background and is polled through the returned job id. The caller is identified by the {@code
 * X-User-Id} header.
 */
@RestController
@RequestMapping("/api/clips")
@Tag(name = "Clips", description = "Clip upload, analysis status and deletion")
public class ClipController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipController.class);

  static final String USER_HEADER = "X-User-Id";

  private final ClipService clipService;
  private final ZoneId montageZone;

  public ClipController(ClipService clipService, ZoneId montageZone) {
    this.clipService = clipService;
    this.montageZone = montageZone;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a clip",
      description =
          "Store a video and start analysing it against the user's prompt. "
              + "Returns a job id for status polling.")
  public ResponseEntity<?> upload(
      @RequestHeader(USER_HEADER) String userId,
      @RequestParam(value = "video", required = false) MultipartFile video,
      @RequestParam(value = "userPrompt", required = false) String userPrompt,
      @RequestParam(value = "date", required = false) String date) {

    if (video == null || video.isEmpty()) {
      return ResponseEntity.badRequest().body(new MessageResponse("No file was uploaded."));
    }
    if (userPrompt == null || userPrompt.isBlank()) {
      return ResponseEntity.badRequest().body(new MessageResponse("userPrompt is required."));
    }
    if (date == null || date.isBlank()) {
      return ResponseEntity.badRequest().body(new MessageResponse("date is required."));
    }
    Optional<Instant> capturedAt = parseDate(date);
    if (capturedAt.isEmpty()) {
      return ResponseEntity.badRequest()
          .body(new MessageResponse("date must be an ISO-8601 date or timestamp."));
    }

    try {
      UploadJob job =
          clipService.acceptUpload(
              userId,
              video.getOriginalFilename(),
              video.getContentType(),
              video.getBytes(),
              userPrompt,
              capturedAt.get());
      return ResponseEntity.accepted()
          .body(
              new ClipUploadResponse(
                  job.jobId(),
                  job.uploadUrl(),
                  "Video uploaded successfully. Processing has started in the background."));

    } catch (IOException | RuntimeException e) {
      LOGGER.error("Failed to accept upload for user {}", userId, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new MessageResponse("Failed to initialize upload job."));
    }
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get upload job status", description = "Poll the analysis of an upload")
  public ResponseEntity<?> getJobStatus(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String jobId) {
    Optional<UploadJob> found = clipService.getUploadJob(jobId);
    if (found.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new MessageResponse("Job not found."));
    }
    UploadJob job = found.get();
    if (!job.userId().equals(userId)) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
          .body(new MessageResponse("You are not authorized to view this job."));
    }

    ClipResponse clip = null;
    if (job.status() == UploadJobStatus.COMPLETED && job.clipId() != null) {
      clip = clipService.getClip(job.clipId()).map(ClipResponse::from).orElse(null);
    }
    String error = job.status() == UploadJobStatus.FAILED ? job.error() : null;
    return ResponseEntity.ok(
        new ClipJobStatusResponse(
            job.jobId(), job.status(), job.uploadUrl(), job.updatedAt(), clip, error));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a clip", description = "Delete a clip and its stored media")
  public ResponseEntity<MessageResponse> delete(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
    try {
      if (!clipService.deleteClip(userId, id)) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(
                new MessageResponse(
                    "Clip not found or you do not have permission to delete it."));
      }
      return ResponseEntity.ok(new MessageResponse("Clip deleted successfully."));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to delete clip {}", id, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new MessageResponse("Failed to delete clip."));
    }
  }

  /** Accepts a full timestamp or a plain date, which is read as start of day in the montage zone. */
  private Optional<Instant> parseDate(String date) {
    try {
      return Optional.of(Instant.parse(date));
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(LocalDate.parse(date).atStartOfDay(montageZone).toInstant());
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
  }
}
