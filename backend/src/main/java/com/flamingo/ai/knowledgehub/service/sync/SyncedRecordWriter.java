package com.flamingo.ai.knowledgehub.service.sync;

import com.flamingo.ai.knowledgehub.domain.entity.SyncedRecord;
import com.flamingo.ai.knowledgehub.domain.repository.SyncedRecordRepository;
import com.flamingo.ai.knowledgehub.service.sync.airtable.AirtableRecord;
import com.flamingo.ai.knowledgehub.service.sync.airtable.AirtableTable;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes synced records one at a time, each in its own transaction, so a failing record never
 * rolls back the records around it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncedRecordWriter {

  private final SyncedRecordRepository syncedRecordRepository;

  /**
   * Inserts the record or updates the row with the same {@code (externalId, baseId, tableId)}.
   *
   * @param embedded whether the record's vector was just written to the index
   * @return the stored row
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public SyncedRecord upsert(
      String baseId,
      AirtableTable table,
      AirtableRecord record,
      String tenantId,
      boolean embedded) {
    SyncedRecord row =
        syncedRecordRepository
            .findByExternalIdAndBaseIdAndTableId(record.id(), baseId, table.id())
            .orElseGet(
                () ->
                    SyncedRecord.builder()
                        .externalId(record.id())
                        .baseId(baseId)
                        .tableId(table.id())
                        .build());
    boolean created = row.getId() == null;
    row.refreshFrom(
        table.name(), table.primaryFieldName(), record.fields(), record.createdAt(), tenantId);
    if (embedded) {
      row.markEmbedded();
    }
    SyncedRecord saved = syncedRecordRepository.save(row);
    log.debug(
        "{} synced record {} of table {}",
        created ? "Inserted" : "Updated",
        record.id(),
        table.name());
    return saved;
  }

  /** Records that the row's vector was rewritten now. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void markEmbedded(UUID id) {
    syncedRecordRepository
        .findById(id)
        .ifPresent(
            row -> {
              row.markEmbedded();
              syncedRecordRepository.save(row);
            });
  }
}
