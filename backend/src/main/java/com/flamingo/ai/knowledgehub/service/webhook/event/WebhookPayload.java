package com.flamingo.ai.knowledgehub.service.webhook.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON body posted to the automation endpoint.
 *
 * @param type event wire name
 * @param partnerId tenant id, serialized as {@code partner_id}
 * @param data event-specific fields
 * @param timestamp ISO-8601 instant
 */
public record WebhookPayload(
    String type,
    @JsonProperty("partner_id") String partnerId,
    Map<String, Object> data,
    String timestamp) {

  /** Same payload as a plain map, for the audit log. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", type);
    map.put("partner_id", partnerId);
    map.put("data", data);
    map.put("timestamp", timestamp);
    return map;
  }
}
