package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A record was created, updated or deleted in the tabular source. */
public record TabularRecordUpdatedEvent(
    String partnerId,
    Instant timestamp,
    String baseId,
    String tableName,
    String recordId,
    Action action)
    implements OutboundEvent {

  /** Sent as {@code create}, {@code update} or {@code delete}. */
  public enum Action {
    CREATE,
    UPDATE,
    DELETE;

    public String getValue() {
      return name().toLowerCase();
    }
  }

  @Override
  public String type() {
    return OutboundEventType.AIRTABLE_UPDATED.getWireName();
  }

  @Override
  public Map<String, Object> data() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("base_id", baseId);
    data.put("table_name", tableName);
    data.put("record_id", recordId);
    data.put("action", action.getValue());
    return data;
  }
}
