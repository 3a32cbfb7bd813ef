package com.flamingo.ai.knowledgehub.service.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.knowledgehub.domain.enums.TableSyncStatus;

/**
 * Outcome of syncing one table.
 *
 * @param name table name
 * @param syncedCount records upserted
 * @param status success when no record failed, error otherwise
 * @param error first error of the table, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableSyncResult(
    String name, int syncedCount, TableSyncStatus status, String error) {}
