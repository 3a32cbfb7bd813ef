package com.flamingo.ai.knowledgehub.service.rag.citation;

import com.fasterxml.jackson.annotation.JsonValue;

/** How well an answer is supported by its citations. */
public enum ConfidenceLevel {
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }
}
