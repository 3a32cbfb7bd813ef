package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Map;

/** A record as returned by the records API. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirtableRecord(String id, String createdTime, Map<String, Object> fields) {

  public Instant createdAt() {
    return createdTime == null ? null : Instant.parse(createdTime);
  }
}
