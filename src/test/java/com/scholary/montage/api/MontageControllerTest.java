package com.scholary.montage.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.montage.job.MontageJob;
import com.scholary.montage.job.MontageJobUpdate;
import com.scholary.montage.selection.SelectionMode;
import com.scholary.montage.service.MontageService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MontageController.class)
class MontageControllerTest {

  private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
  private static final LocalDate WEEK = LocalDate.of(2026, 10, 18);

  @Autowired private MockMvc mockMvc;

  @MockBean private MontageService montageService;

  @Test
  void create_returnsAcceptedWithJobId() throws Exception {
    when(montageService.runMontagePipeline(anyString(), isNull()))
        .thenReturn(MontageJob.processing("m1", "u1", WEEK, NOW));

    mockMvc
        .perform(post("/api/montages").header("X-User-Id", "u1"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("m1"));
  }

  @Test
  void create_acceptsSelectionMode() throws Exception {
    when(montageService.runMontagePipeline("u1", SelectionMode.PER_SOURCE))
        .thenReturn(MontageJob.processing("m1", "u1", WEEK, NOW));

    mockMvc
        .perform(post("/api/montages").param("mode", "PER_SOURCE").header("X-User-Id", "u1"))
        .andExpect(status().isAccepted());
  }

  @Test
  void create_returnsServerErrorWhenBusy() throws Exception {
    when(montageService.runMontagePipeline(anyString(), isNull()))
        .thenThrow(new TaskRejectedException("queue full"));

    mockMvc
        .perform(post("/api/montages").header("X-User-Id", "u1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.message").value("Failed to start montage creation."));
  }

  @Test
  void getJobStatus_returnsCompletedMontage() throws Exception {
    MontageJob job =
        MontageJob.processing("m1", "u1", WEEK, NOW)
            .apply(MontageJobUpdate.complete("http://store/m.mp4", "http://store/m.jpg", NOW));
    when(montageService.getJobStatus("m1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/montages/jobs/m1").header("X-User-Id", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("complete"))
        .andExpect(jsonPath("$.videoUrl").value("http://store/m.mp4"))
        .andExpect(jsonPath("$.weekEnding").value("2026-10-18"))
        .andExpect(jsonPath("$.failureReason").doesNotExist());
  }

  @Test
  void getJobStatus_returnsFailureReason() throws Exception {
    MontageJob job =
        MontageJob.processing("m1", "u1", WEEK, NOW)
            .apply(MontageJobUpdate.failed("No clips found for week ending 2026-10-18"));
    when(montageService.getJobStatus("m1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/montages/jobs/m1").header("X-User-Id", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("failed"))
        .andExpect(jsonPath("$.failureReason").value("No clips found for week ending 2026-10-18"));
  }

  @Test
  void getJobStatus_checksOwnership() throws Exception {
    when(montageService.getJobStatus("m1"))
        .thenReturn(Optional.of(MontageJob.processing("m1", "u2", WEEK, NOW)));
    when(montageService.getJobStatus("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/montages/jobs/m1").header("X-User-Id", "u1"))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/api/montages/jobs/missing").header("X-User-Id", "u1"))
        .andExpect(status().isNotFound());
  }

  @Test
  void delete_mapsOutcomes() throws Exception {
    when(montageService.deleteMontage("u1", "m1")).thenReturn(true);
    when(montageService.deleteMontage("u1", "m2")).thenReturn(false);

    mockMvc
        .perform(delete("/api/montages/m1").header("X-User-Id", "u1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Montage deleted successfully."));
    mockMvc
        .perform(delete("/api/montages/m2").header("X-User-Id", "u1"))
        .andExpect(status().isNotFound());
  }
}
