package com.scholary.montage.api;

import com.scholary.montage.job.MontageJob;
import com.scholary.montage.selection.SelectionMode;
import com.scholary.montage.service.MontageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for weekly montages.
 *
 * <p>Montage creation is asynchronous: the request returns 202 with a job id once the job record
 * exists, and the outcome is read by polling that job.
 */
@RestController
@RequestMapping("/api/montages")
@Tag(name = "Montages", description = "Weekly highlight montage creation and status")
public class MontageController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MontageController.class);

  private final MontageService montageService;

  public MontageController(MontageService montageService) {
    this.montageService = montageService;
  }

  @PostMapping
  @Operation(
      summary = "Create this week's montage",
      description =
          "Start assembling a montage from the user's clips for the current week. "
              + "FLAT_POOL prunes the whole pool; PER_SOURCE keeps the best segment per video.")
  public ResponseEntity<?> create(
      @RequestHeader(ClipController.USER_HEADER) String userId,
      @RequestParam(value = "mode", required = false) SelectionMode mode) {
    try {
      MontageJob job = montageService.runMontagePipeline(userId, mode);
      return ResponseEntity.accepted()
          .body(
              new MontageStartResponse(
                  job.id(), "Montage creation started. Poll the job for its status."));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to start montage for user {}", userId, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new MessageResponse("Failed to start montage creation."));
    }
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get montage job status", description = "Poll a montage run")
  public ResponseEntity<?> getJobStatus(
      @RequestHeader(ClipController.USER_HEADER) String userId, @PathVariable String jobId) {
    Optional<MontageJob> found = montageService.getJobStatus(jobId);
    if (found.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(new MessageResponse("Job not found."));
    }
    if (!found.get().userId().equals(userId)) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
          .body(new MessageResponse("You are not authorized to view this job."));
    }
    return ResponseEntity.ok(MontageJobResponse.from(found.get()));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a montage", description = "Delete a montage and its stored media")
  public ResponseEntity<MessageResponse> delete(
      @RequestHeader(ClipController.USER_HEADER) String userId, @PathVariable String id) {
    try {
      if (!montageService.deleteMontage(userId, id)) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(
                new MessageResponse(
                    "Montage not found or you do not have permission to delete it."));
      }
      return ResponseEntity.ok(new MessageResponse("Montage deleted successfully."));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to delete montage {}", id, e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(new MessageResponse("Failed to delete montage."));
    }
  }
}
