package com.flamingo.ai.messagesearch.api.rest;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.messagesearch.domain.enums.IndexingState;
import com.flamingo.ai.messagesearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.messagesearch.exception.IndexingRunActiveException;
import com.flamingo.ai.messagesearch.service.indexing.IndexingJobScheduler;
import com.flamingo.ai.messagesearch.service.indexing.IndexingProgress;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexingController Tests")
class IndexingControllerTest {

  private MockMvc mockMvc;
  private SimpleMeterRegistry meterRegistry;

  @Mock private IndexingJobScheduler scheduler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new IndexingController(scheduler))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should accept a new run")
  void shouldAcceptNewRun() throws Exception {
    when(scheduler.isRunning()).thenReturn(true);
    when(scheduler.currentProgress()).thenReturn(IndexingProgress.idle());

    mockMvc
        .perform(post("/api/indexing/runs"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.state").value("IDLE"));

    verify(scheduler).startRun();
  }

  @Test
  @DisplayName("Should answer 409 while a run is active")
  void shouldRejectOverlappingRun() throws Exception {
    when(scheduler.startRun()).thenThrow(new IndexingRunActiveException());

    mockMvc
        .perform(post("/api/indexing/runs"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INDEXING_001"))
        .andExpect(jsonPath("$.message").value("An indexing run is already active"));
  }

  @Test
  @DisplayName("Should request cancellation of the active run")
  void shouldCancelActiveRun() throws Exception {
    when(scheduler.requestCancellation()).thenReturn(true);
    when(scheduler.isRunning()).thenReturn(true);
    when(scheduler.currentProgress())
        .thenReturn(
            new IndexingProgress(
                IndexingState.BATCH_PROCESSING, 40, 0, 100, "Indexed 40 / 100 messages"));

    mockMvc
        .perform(delete("/api/indexing/runs/current"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.processed").value(40))
        .andExpect(jsonPath("$.progress").value(0.4));
  }

  @Test
  @DisplayName("Should answer 404 when there is nothing to cancel")
  void shouldReturnNotFoundWithoutActiveRun() throws Exception {
    when(scheduler.requestCancellation()).thenReturn(false);

    mockMvc.perform(delete("/api/indexing/runs/current")).andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should report the latest status")
  void shouldReportStatus() throws Exception {
    when(scheduler.isRunning()).thenReturn(false);
    when(scheduler.currentProgress())
        .thenReturn(
            new IndexingProgress(
                IndexingState.COMPLETED, 3, 1, 4, "Indexing complete! 3 messages indexed"));

    mockMvc
        .perform(get("/api/indexing/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(false))
        .andExpect(jsonPath("$.state").value("COMPLETED"))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.total").value(4));
  }
}
