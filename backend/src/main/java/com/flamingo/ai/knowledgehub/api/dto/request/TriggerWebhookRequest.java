package com.flamingo.ai.knowledgehub.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for posting an arbitrary event to the automation host. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerWebhookRequest {

  @NotBlank(message = "Event type is required")
  private String type;

  @NotBlank(message = "Partner id is required")
  private String partnerId;

  private Map<String, Object> data;
}
