package com.flamingo.ai.knowledgehub.api.dto.response;

import com.flamingo.ai.knowledgehub.domain.entity.WebhookLog;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a webhook audit row. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookLogResponse {

  private UUID id;
  private String direction;
  private String endpoint;
  private String eventType;
  private Map<String, Object> payload;
  private Map<String, Object> response;
  private String status;
  private int attempts;
  private Instant createdAt;

  public static WebhookLogResponse fromEntity(WebhookLog log) {
    return WebhookLogResponse.builder()
        .id(log.getId())
        .direction(log.getDirection().name().toLowerCase())
        .endpoint(log.getEndpoint())
        .eventType(log.getEventType())
        .payload(log.getPayload())
        .response(log.getResponse())
        .status(log.getStatus().name().toLowerCase())
        .attempts(log.getAttempts())
        .createdAt(log.getCreatedAt())
        .build();
  }
}
