package com.flamingo.ai.knowledgehub.service.sync;

import java.util.List;

/**
 * Outcome of a sync run.
 *
 * @param success true when at least one table synced at least one record
 * @param tables per-table outcome in sync order
 * @param totalRecords records upserted across all tables
 * @param errors every error of the run in the order it happened
 */
public record SyncResult(
    boolean success, List<TableSyncResult> tables, int totalRecords, List<String> errors) {}
