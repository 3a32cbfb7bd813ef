package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A piece of content such as a report or a presentation was generated. */
public record ContentGeneratedEvent(
    String partnerId, Instant timestamp, String contentId, String contentType, String title)
    implements OutboundEvent {

  @Override
  public String type() {
    return OutboundEventType.CONTENT_GENERATED.getWireName();
  }

  @Override
  public Map<String, Object> data() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("content_id", contentId);
    data.put("content_type", contentType);
    data.put("title", title);
    return data;
  }
}
