package com.flamingo.ai.knowledgehub.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of syncing one table within a sync run. */
public enum TableSyncStatus {
  /** Every fetched record was upserted. */
  SUCCESS,

  /** The fetch failed or at least one record failed. */
  ERROR;

  @JsonValue
  public String toValue() {
    return name().toLowerCase();
  }
}
