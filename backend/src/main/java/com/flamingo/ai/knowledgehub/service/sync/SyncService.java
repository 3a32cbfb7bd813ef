package com.flamingo.ai.knowledgehub.service.sync;

import java.util.Map;

/** Keeps the local store and the vector index consistent with the external tabular source. */
public interface SyncService {

  /**
   * Pulls every selected table and upserts its records. Failures of single records or tables are
   * reported in the result and never abort the run.
   *
   * @param options table selection, embedding toggle and tenant
   * @return per-table outcome and aggregate counts
   * @throws com.flamingo.ai.knowledgehub.exception.SyncConfigurationException if credentials,
   *     base id or tenant are missing
   */
  SyncResult syncAll(SyncOptions options);

  /**
   * Re-renders, re-embeds and re-indexes every synced record of a table.
   *
   * @param tableName the table name
   * @return number of records updated and one message per failed record
   */
  ReembedResult reembedTable(String tableName);

  /**
   * Creates (no record id) or updates one record in the external source. Never throws.
   *
   * @param tableName table name or id
   * @param recordId record to update, null to create a new one
   * @param fields field values; the source coerces them to the column types
   * @return the written record, or the error
   */
  PushResult push(String tableName, String recordId, Map<String, Object> fields);

  /**
   * Deletes all synced records of a table together with their index chunks.
   *
   * @param tableName the table name
   * @return rows and chunks removed
   */
  DeleteResult deleteTable(String tableName);

  /** Reports whether the source is configured, the last run and per-table counts. */
  SyncStatusReport getStatus();
}
