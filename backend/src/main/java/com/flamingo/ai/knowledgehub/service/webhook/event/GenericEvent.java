package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Any other event; posted to the general endpoint unless its type is a known one. */
public record GenericEvent(
    String type, String partnerId, Instant timestamp, Map<String, Object> data)
    implements OutboundEvent {

  public GenericEvent {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
