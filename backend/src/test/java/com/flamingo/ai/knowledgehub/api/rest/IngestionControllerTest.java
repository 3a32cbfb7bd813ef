package com.flamingo.ai.knowledgehub.api.rest;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledgehub.service.ingest.ChunkIngestionService;
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
@DisplayName("IngestionController Tests")
class IngestionControllerTest {

  @Mock private ChunkIngestionService chunkIngestionService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new IngestionController(chunkIngestionService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should delete a document's chunks for the given tenant")
  void shouldDeleteDocumentForTenant() throws Exception {
    when(chunkIngestionService.deleteSource("tenant-2", SourceType.DOCUMENT, "doc-1"))
        .thenReturn(3L);

    mockMvc
        .perform(delete("/api/documents/doc-1/chunks").param("tenantId", "tenant-2"))
        .andExpect(status().isNoContent());

    verify(chunkIngestionService).deleteSource("tenant-2", SourceType.DOCUMENT, "doc-1");
  }

  @Test
  @DisplayName("Should delete a meeting's chunks for the given tenant")
  void shouldDeleteMeetingForTenant() throws Exception {
    mockMvc
        .perform(delete("/api/meetings/meet-1/chunks").param("tenantId", "tenant-1"))
        .andExpect(status().isNoContent());

    verify(chunkIngestionService).deleteSource("tenant-1", SourceType.MEETING, "meet-1");
  }

  @Test
  @DisplayName("Should reject a delete without a tenant")
  void shouldRejectDeleteWithoutTenant() throws Exception {
    mockMvc
        .perform(delete("/api/documents/doc-1/chunks"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("tenantId: is required"));

    verifyNoInteractions(chunkIngestionService);
  }
}
