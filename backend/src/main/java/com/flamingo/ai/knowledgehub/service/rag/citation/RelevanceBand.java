package com.flamingo.ai.knowledgehub.service.rag.citation;

import com.fasterxml.jackson.annotation.JsonValue;

/** Display band of a citation's relevance score. */
public enum RelevanceBand {
  HIGH_MATCH(0.9, "High match"),
  GOOD_MATCH(0.8, "Good match"),
  RELEVANT(0.7, "Relevant"),
  PARTIAL_MATCH(Double.NEGATIVE_INFINITY, "Partial match");

  private final double lowerBound;
  private final String label;

  RelevanceBand(double lowerBound, String label) {
    this.lowerBound = lowerBound;
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /** Highest band whose lower bound the score reaches. */
  public static RelevanceBand of(double score) {
    for (RelevanceBand band : values()) {
      if (score >= band.lowerBound) {
        return band;
      }
    }
    return PARTIAL_MATCH;
  }
}
