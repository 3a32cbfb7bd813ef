package com.flamingo.ai.knowledgehub.api.rest;

import com.flamingo.ai.knowledgehub.api.dto.request.TriggerWebhookRequest;
import com.flamingo.ai.knowledgehub.api.dto.response.WebhookLogResponse;
import com.flamingo.ai.knowledgehub.domain.repository.WebhookLogRepository;
import com.flamingo.ai.knowledgehub.service.webhook.WebhookDispatcher;
import com.flamingo.ai.knowledgehub.service.webhook.WebhookTriggerResponse;
import com.flamingo.ai.knowledgehub.service.webhook.event.GenericEvent;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for manual webhook triggers and the delivery log. */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

  private final WebhookDispatcher webhookDispatcher;
  private final WebhookLogRepository webhookLogRepository;

  /** Delivers an event synchronously and returns the outcome. */
  @PostMapping("/trigger")
  public ResponseEntity<WebhookTriggerResponse> trigger(
      @Valid @RequestBody TriggerWebhookRequest request) {
    GenericEvent event =
        new GenericEvent(
            request.getType(), request.getPartnerId(), Instant.now(), request.getData());
    return ResponseEntity.ok(webhookDispatcher.trigger(event));
  }

  /** The 50 most recent delivery outcomes. */
  @GetMapping("/logs")
  public ResponseEntity<List<WebhookLogResponse>> logs() {
    return ResponseEntity.ok(
        webhookLogRepository.findTop50ByOrderByCreatedAtDesc().stream()
            .map(WebhookLogResponse::fromEntity)
            .toList());
  }
}
