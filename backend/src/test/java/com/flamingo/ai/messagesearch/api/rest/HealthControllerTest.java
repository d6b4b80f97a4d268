package com.flamingo.ai.messagesearch.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import com.flamingo.ai.messagesearch.service.embedding.CorpusSnapshotRegistry;
import com.flamingo.ai.messagesearch.service.message.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  private MockMvc mockMvc;

  @Mock private MessageService messageService;

  @BeforeEach
  void setUp() {
    CorpusSnapshotRegistry registry = new CorpusSnapshotRegistry(new SemanticSearchConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(messageService, registry)).build();
  }

  @Test
  @DisplayName("Should report the service as up")
  void shouldReportUp() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("message-search"));
  }

  @Test
  @DisplayName("Should report index coverage and corpus snapshot")
  void shouldReportStats() throws Exception {
    when(messageService.getCoverage()).thenReturn(new MessageService.IndexCoverage(10, 7));

    mockMvc
        .perform(get("/api/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalMessages").value(10))
        .andExpect(jsonPath("$.embeddedMessages").value(7))
        .andExpect(jsonPath("$.pendingMessages").value(3))
        .andExpect(jsonPath("$.corpus.embeddingDimension").value(384))
        .andExpect(jsonPath("$.corpus.totalDocuments").value(0));
  }
}
