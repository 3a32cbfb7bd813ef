package com.flamingo.ai.knowledgehub.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgehub.api.rest.AirtableSyncController;
import com.flamingo.ai.knowledgehub.api.rest.IngestionController;
import com.flamingo.ai.knowledgehub.api.rest.RetrievalController;
import com.flamingo.ai.knowledgehub.api.rest.WebhookController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the controller base paths.
 *
 * <ul>
 *   <li>POST /api/airtable/sync - Run a sync
 *   <li>GET /api/airtable/sync - Sync status
 *   <li>POST /api/retrieval/ground - Context, citations and confidence
 *   <li>PUT /api/documents/{id}/chunks - Index document chunks
 *   <li>POST /api/webhooks/trigger - Deliver an event
 * </ul>
 */
class ApiContractTest {

  @Test
  @DisplayName("AirtableSyncController should be mapped to /api/airtable")
  void airtableSyncControllerMapping() {
    assertThat(pathOf(AirtableSyncController.class)).containsExactly("/api/airtable");
  }

  @Test
  @DisplayName("RetrievalController should be mapped to /api/retrieval")
  void retrievalControllerMapping() {
    assertThat(pathOf(RetrievalController.class)).containsExactly("/api/retrieval");
  }

  @Test
  @DisplayName("IngestionController should be mapped under /api prefix")
  void ingestionControllerMapping() {
    assertThat(pathOf(IngestionController.class)).containsExactly("/api");
  }

  @Test
  @DisplayName("WebhookController should be mapped to /api/webhooks")
  void webhookControllerMapping() {
    assertThat(pathOf(WebhookController.class)).containsExactly("/api/webhooks");
  }

  private static String[] pathOf(Class<?> controller) {
    RequestMapping mapping = controller.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    return mapping.value();
  }
}
