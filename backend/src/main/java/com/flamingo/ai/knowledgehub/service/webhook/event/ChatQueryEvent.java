package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A chat question was answered. */
public record ChatQueryEvent(
    String partnerId,
    Instant timestamp,
    String conversationId,
    String message,
    List<String> sourcesUsed)
    implements OutboundEvent {

  @Override
  public String type() {
    return OutboundEventType.CHAT_QUERY.getWireName();
  }

  @Override
  public Map<String, Object> data() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("conversation_id", conversationId);
    data.put("message", message);
    data.put("sources_used", sourcesUsed == null ? List.of() : sourcesUsed);
    return data;
  }
}
