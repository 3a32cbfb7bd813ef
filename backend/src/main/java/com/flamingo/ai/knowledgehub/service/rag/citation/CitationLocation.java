package com.flamingo.ai.knowledgehub.service.rag.citation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where inside its source a cited chunk sits.
 *
 * @param kind what {@code value} denotes
 * @param value page number, timestamp, field key or chunk index, rendered as text
 */
public record CitationLocation(Kind kind, String value) {

  public enum Kind {
    PAGE,
    TIMESTAMP,
    FIELD,
    CHUNK;

    @JsonValue
    public String getValue() {
      return name().toLowerCase();
    }
  }

  public static CitationLocation page(int pageNumber) {
    return new CitationLocation(Kind.PAGE, String.valueOf(pageNumber));
  }

  public static CitationLocation timestamp(String timestamp) {
    return new CitationLocation(Kind.TIMESTAMP, timestamp);
  }

  public static CitationLocation field(String fieldKey) {
    return new CitationLocation(Kind.FIELD, fieldKey);
  }

  public static CitationLocation chunk(int chunkIndex) {
    return new CitationLocation(Kind.CHUNK, String.valueOf(chunkIndex));
  }

  /** Short human-readable form, e.g. {@code Page 4} or {@code Field: Revenue}. */
  public String label() {
    return switch (kind) {
      case PAGE -> "Page " + value;
      case TIMESTAMP -> "At " + value;
      case FIELD -> "Field: " + value;
      case CHUNK -> "Section " + (Integer.parseInt(value) + 1);
    };
  }
}
