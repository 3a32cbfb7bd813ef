package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.Map;

/**
 * An event published to downstream automations. Each variant carries its own typed fields and
 * renders them as the snake_case {@code data} object of the wire payload.
 */
public sealed interface OutboundEvent
    permits DocumentUploadedEvent,
        ChatQueryEvent,
        ContentGeneratedEvent,
        MeetingSyncedEvent,
        TabularRecordUpdatedEvent,
        GenericEvent {

  /** Wire name of the event, e.g. {@code new_document}. */
  String type();

  /** Tenant the event belongs to. */
  String partnerId();

  Instant timestamp();

  /** Event-specific fields as written to the payload's {@code data} object. */
  Map<String, Object> data();

  /** Converts the event into its JSON payload. */
  default WebhookPayload toPayload() {
    return new WebhookPayload(type(), partnerId(), data(), timestamp().toString());
  }
}
