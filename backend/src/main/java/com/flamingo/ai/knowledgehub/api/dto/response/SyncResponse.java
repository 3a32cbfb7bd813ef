package com.flamingo.ai.knowledgehub.api.dto.response;

import com.flamingo.ai.knowledgehub.service.sync.SyncResult;

/** Response DTO for a sync run. */
public record SyncResponse(boolean success, String message, SyncResult details) {

  public static SyncResponse from(SyncResult result) {
    return new SyncResponse(
        result.success(),
        String.format(
            "Synced %d records from %d Airtable tables",
            result.totalRecords(), result.tables().size()),
        result);
  }
}
