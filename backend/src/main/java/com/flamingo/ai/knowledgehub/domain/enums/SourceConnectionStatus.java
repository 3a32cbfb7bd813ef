package com.flamingo.ai.knowledgehub.domain.enums;

/** Last known health of an external data source, as recorded after each sync run. */
public enum SourceConnectionStatus {
  /** The last run synced at least one record. */
  CONNECTED,

  /** The last run synced nothing. */
  ERROR
}
