package com.flamingo.ai.knowledgehub.service.webhook.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A document was uploaded and indexed. */
public record DocumentUploadedEvent(
    String partnerId,
    Instant timestamp,
    String documentId,
    String documentName,
    String documentType,
    Integer pageCount)
    implements OutboundEvent {

  @Override
  public String type() {
    return OutboundEventType.NEW_DOCUMENT.getWireName();
  }

  @Override
  public Map<String, Object> data() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("document_id", documentId);
    data.put("document_name", documentName);
    data.put("document_type", documentType);
    data.put("page_count", pageCount);
    return data;
  }
}
