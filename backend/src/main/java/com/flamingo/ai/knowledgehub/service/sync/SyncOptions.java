package com.flamingo.ai.knowledgehub.service.sync;

import java.util.List;
import lombok.Builder;

/**
 * Options of one sync run.
 *
 * @param tables table names or ids to sync; null or empty syncs every table
 * @param embedRecords whether records are embedded and indexed; null uses {@code
 *     airtable.embed-records}
 * @param tenantId tenant that owns the synced records; null uses {@code
 *     airtable.default-tenant-id}
 */
@Builder
public record SyncOptions(List<String> tables, Boolean embedRecords, String tenantId) {

  public static SyncOptions defaults() {
    return SyncOptions.builder().build();
  }
}
