package com.flamingo.ai.knowledgehub.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Defines the corpus a retrievable chunk belongs to. */
public enum SourceType {
  /** Chunk of an uploaded document. */
  DOCUMENT("document", "document"),

  /** Chunk of a synced meeting transcript. */
  MEETING("meeting", "meeting"),

  /** One record synced from the tabular source. */
  TABULAR("tabular", "tabular record");

  private final String value;
  private final String label;

  SourceType(String value, String label) {
    this.value = value;
    this.label = label;
  }

  /** Value stored in the index and written on the wire. */
  @JsonValue
  public String getValue() {
    return value;
  }

  /** Human-readable singular noun used in explanations. */
  public String getLabel() {
    return label;
  }

  /** Resolves a stored value back to the enum constant. */
  public static SourceType fromValue(String value) {
    for (SourceType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown source type: " + value);
  }
}
