package com.flamingo.ai.knowledgehub.service.sync;

import com.flamingo.ai.knowledgehub.domain.entity.DataSourceStatus;
import java.time.Instant;
import java.util.List;

/**
 * Current state of the tabular source.
 *
 * @param configured whether credentials and base id are present
 * @param status snapshot of the last run, null if no run has completed
 * @param tables synced record count per table
 */
public record SyncStatusReport(boolean configured, LastRun status, List<TableCount> tables) {

  /** Snapshot of the last sync run. */
  public record LastRun(
      String source,
      Instant lastSync,
      String status,
      int itemCount,
      String lastError,
      String baseId,
      int tablesSynced) {

    static LastRun of(DataSourceStatus row) {
      return new LastRun(
          row.getSource(),
          row.getLastSync(),
          row.getStatus().name().toLowerCase(),
          row.getItemCount(),
          row.getLastError(),
          row.getBaseId(),
          row.getTablesSynced());
    }
  }

  public record TableCount(String name, long count) {}
}
