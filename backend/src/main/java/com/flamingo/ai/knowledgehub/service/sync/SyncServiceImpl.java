package com.flamingo.ai.knowledgehub.service.sync;

import com.flamingo.ai.knowledgehub.config.AirtableConfig;
import com.flamingo.ai.knowledgehub.domain.entity.DataSourceStatus;
import com.flamingo.ai.knowledgehub.domain.entity.SyncedRecord;
import com.flamingo.ai.knowledgehub.domain.enums.SourceConnectionStatus;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.domain.enums.TableSyncStatus;
import com.flamingo.ai.knowledgehub.domain.repository.DataSourceStatusRepository;
import com.flamingo.ai.knowledgehub.domain.repository.SyncedRecordRepository;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunkIndexService;
import com.flamingo.ai.knowledgehub.exception.SyncConfigurationException;
import com.flamingo.ai.knowledgehub.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgehub.service.sync.airtable.AirtableRecord;
import com.flamingo.ai.knowledgehub.service.sync.airtable.AirtableTable;
import com.flamingo.ai.knowledgehub.service.sync.airtable.TabularSourceClient;
import com.flamingo.ai.knowledgehub.service.webhook.WebhookDispatcher;
import com.flamingo.ai.knowledgehub.service.webhook.event.TabularRecordUpdatedEvent;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Sync engine for an Airtable base. Tables are synced one after another, records one by one. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncServiceImpl implements SyncService {

  private final TabularSourceClient tabularSourceClient;
  private final SyncedRecordWriter syncedRecordWriter;
  private final SyncedRecordRepository syncedRecordRepository;
  private final DataSourceStatusRepository dataSourceStatusRepository;
  private final EmbeddingService embeddingService;
  private final SourceChunkIndexService sourceChunkIndexService;
  private final RecordTextRenderer recordTextRenderer;
  private final WebhookDispatcher webhookDispatcher;
  private final AirtableConfig airtableConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "sync.run", description = "Time for a full tabular sync run")
  public SyncResult syncAll(SyncOptions options) {
    SyncOptions effective = options != null ? options : SyncOptions.defaults();
    requireConfigured();
    String tenantId = resolveTenant(effective.tenantId());
    boolean embed =
        effective.embedRecords() != null
            ? effective.embedRecords()
            : airtableConfig.isEmbedRecords();
    String baseId = airtableConfig.getBaseId();

    log.info("Starting sync of base {} for tenant {} (embed={})", baseId, tenantId, embed);
    List<TableSyncResult> tables = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    int totalRecords = 0;

    try {
      List<AirtableTable> selected = selectTables(tabularSourceClient.listTables(), effective);
      for (AirtableTable table : selected) {
        TableSyncResult tableResult = syncTable(baseId, table, tenantId, embed, errors);
        tables.add(tableResult);
        totalRecords += tableResult.syncedCount();
      }
    } catch (RuntimeException e) {
      log.error("Sync of base {} failed: {}", baseId, e.getMessage(), e);
      errors.add("Sync failed: " + e.getMessage());
    }

    boolean success = tables.stream().anyMatch(t -> t.syncedCount() > 0);
    saveStatus(baseId, success, totalRecords, tables.size(), errors);
    log.info(
        "Finished sync of base {}: success={}, tables={}, records={}, errors={}",
        baseId,
        success,
        tables.size(),
        totalRecords,
        errors.size());
    return new SyncResult(success, List.copyOf(tables), totalRecords, List.copyOf(errors));
  }

  private TableSyncResult syncTable(
      String baseId, AirtableTable table, String tenantId, boolean embed, List<String> runErrors) {
    List<AirtableRecord> records;
    try {
      records = tabularSourceClient.listAllRecords(table.id());
    } catch (RuntimeException e) {
      String error = "Failed to fetch table " + table.name() + ": " + e.getMessage();
      log.warn(error);
      runErrors.add(error);
      return new TableSyncResult(table.name(), 0, TableSyncStatus.ERROR, error);
    }

    int synced = 0;
    List<String> tableErrors = new ArrayList<>();
    for (AirtableRecord record : records) {
      boolean indexed = false;
      try {
        String previousTenant = previousOwner(baseId, table.id(), record.id(), tenantId);
        if (embed) {
          indexRecord(
              SyncedRecord.chunkId(tenantId, baseId, table.id(), record.id()),
              tenantId,
              table.id(),
              table.name(),
              table.primaryFieldName(),
              record.id(),
              record.fields());
          indexed = true;
        }
        syncedRecordWriter.upsert(baseId, table, record, tenantId, embed);
        synced++;
        if (previousTenant != null) {
          removeRecordChunk(previousTenant, record.id());
        }
      } catch (RuntimeException e) {
        String error = "Failed to sync record " + record.id() + ": " + e.getMessage();
        log.warn("{} (table {})", error, table.name());
        tableErrors.add(error);
        if (indexed) {
          // no row points at this chunk
          removeRecordChunk(tenantId, record.id());
        }
      }
    }
    meterRegistry.counter("sync.records.synced").increment(synced);
    meterRegistry.counter("sync.records.failed").increment(tableErrors.size());
    runErrors.addAll(tableErrors);

    log.info("Synced {}/{} record(s) of table {}", synced, records.size(), table.name());
    return tableErrors.isEmpty()
        ? new TableSyncResult(table.name(), synced, TableSyncStatus.SUCCESS, null)
        : new TableSyncResult(table.name(), synced, TableSyncStatus.ERROR, tableErrors.get(0));
  }

  @Override
  @Timed(value = "sync.reembed", description = "Time to re-embed a synced table")
  public ReembedResult reembedTable(String tableName) {
    requireTableName(tableName);
    List<SyncedRecord> rows =
        syncedRecordRepository.findByTableNameAndSourceOrderBySyncedAtAsc(
            tableName, SyncedRecord.SOURCE_AIRTABLE);
    log.info("Re-embedding {} record(s) of table {}", rows.size(), tableName);

    int updated = 0;
    List<String> errors = new ArrayList<>();
    for (SyncedRecord row : rows) {
      try {
        indexRecord(
            row.chunkId(),
            row.getTenantId(),
            row.getTableId(),
            row.getTableName(),
            row.getPrimaryField(),
            row.getExternalId(),
            row.getFields());
        syncedRecordWriter.markEmbedded(row.getId());
        updated++;
      } catch (RuntimeException e) {
        String error = "Failed to re-embed record " + row.getExternalId() + ": " + e.getMessage();
        log.warn(error);
        errors.add(error);
      }
    }
    meterRegistry.counter("sync.records.reembedded").increment(updated);
    return new ReembedResult(updated, List.copyOf(errors));
  }

  @Override
  public PushResult push(String tableName, String recordId, Map<String, Object> fields) {
    if (!airtableConfig.isConfigured()) {
      return PushResult.failed("Airtable not configured");
    }
    try {
      AirtableRecord written =
          recordId == null || recordId.isBlank()
              ? tabularSourceClient.createRecord(tableName, fields)
              : tabularSourceClient.updateRecord(tableName, recordId, fields);
      meterRegistry.counter("sync.push.success").increment();
      log.info("Pushed record {} to table {}", written.id(), tableName);
      publishUpdate(
          tableName,
          written.id(),
          recordId == null || recordId.isBlank()
              ? TabularRecordUpdatedEvent.Action.CREATE
              : TabularRecordUpdatedEvent.Action.UPDATE);
      return PushResult.written(written);
    } catch (RuntimeException e) {
      meterRegistry.counter("sync.push.failure").increment();
      log.warn("Push to table {} failed: {}", tableName, e.getMessage());
      return PushResult.failed(e.getMessage() != null ? e.getMessage() : "Unknown error");
    }
  }

  @Override
  @Transactional
  public DeleteResult deleteTable(String tableName) {
    requireTableName(tableName);
    long chunks = 0;
    for (String tenantId :
        syncedRecordRepository.findTenantIdsByTableNameAndSource(
            tableName, SyncedRecord.SOURCE_AIRTABLE)) {
      chunks += sourceChunkIndexService.deleteByCollection(tenantId, SourceType.TABULAR, tableName);
    }
    int deleted =
        syncedRecordRepository.deleteByTableNameAndSource(tableName, SyncedRecord.SOURCE_AIRTABLE);
    log.info("Deleted {} synced record(s) and {} chunk(s) of table {}", deleted, chunks, tableName);
    return new DeleteResult(deleted, chunks);
  }

  @Override
  @Transactional(readOnly = true)
  public SyncStatusReport getStatus() {
    SyncStatusReport.LastRun lastRun =
        dataSourceStatusRepository
            .findById(SyncedRecord.SOURCE_AIRTABLE)
            .map(SyncStatusReport.LastRun::of)
            .orElse(null);
    List<SyncStatusReport.TableCount> tables =
        syncedRecordRepository.countByTable(SyncedRecord.SOURCE_AIRTABLE).stream()
            .map(c -> new SyncStatusReport.TableCount(c.getTableName(), c.getRecordCount()))
            .toList();
    return new SyncStatusReport(airtableConfig.isConfigured(), lastRun, tables);
  }

  private void indexRecord(
      String chunkId,
      String tenantId,
      String tableId,
      String tableName,
      String primaryField,
      String externalId,
      Map<String, Object> fields) {
    String text = recordTextRenderer.render(tableName, fields);
    List<Float> embedding = embeddingService.embed(text);
    SourceChunk chunk =
        SourceChunk.builder()
            .id(chunkId)
            .sourceType(SourceType.TABULAR)
            .tenantId(tenantId)
            .sourceId(externalId)
            .sourceName(tableName + " Record")
            .collection(tableName)
            .content(text)
            .embedding(embedding)
            .fieldKey(primaryField)
            .editUrl(tabularSourceClient.recordUrl(tableId, externalId))
            .lastUpdated(Instant.now())
            .build();
    sourceChunkIndexService.indexChunks(List.of(chunk));
  }

  /** Tenant that owned the stored row before this sync, when it differs from {@code tenantId}. */
  private String previousOwner(
      String baseId, String tableId, String externalId, String tenantId) {
    return syncedRecordRepository
        .findByExternalIdAndBaseIdAndTableId(externalId, baseId, tableId)
        .map(SyncedRecord::getTenantId)
        .filter(owner -> !owner.equals(tenantId))
        .orElse(null);
  }

  private void removeRecordChunk(String tenantId, String externalId) {
    try {
      sourceChunkIndexService.deleteBySource(tenantId, SourceType.TABULAR, externalId);
    } catch (RuntimeException e) {
      log.warn(
          "Could not remove chunk of record {} for tenant {}: {}",
          externalId,
          tenantId,
          e.getMessage());
    }
  }

  private void publishUpdate(
      String tableName, String recordId, TabularRecordUpdatedEvent.Action action) {
    try {
      webhookDispatcher.triggerAsync(
          new TabularRecordUpdatedEvent(
              airtableConfig.getDefaultTenantId(),
              Instant.now(),
              airtableConfig.getBaseId(),
              tableName,
              recordId,
              action));
    } catch (RuntimeException e) {
      log.warn("Could not publish update event for record {}: {}", recordId, e.getMessage());
    }
  }

  private void saveStatus(
      String baseId, boolean success, int totalRecords, int tablesSynced, List<String> errors) {
    try {
      dataSourceStatusRepository.save(
          DataSourceStatus.builder()
              .source(SyncedRecord.SOURCE_AIRTABLE)
              .lastSync(Instant.now())
              .status(success ? SourceConnectionStatus.CONNECTED : SourceConnectionStatus.ERROR)
              .itemCount(totalRecords)
              .lastError(errors.isEmpty() ? null : errors.get(0))
              .baseId(baseId)
              .tablesSynced(tablesSynced)
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to save sync status: {}", e.getMessage(), e);
    }
  }

  private static List<AirtableTable> selectTables(
      List<AirtableTable> allTables, SyncOptions options) {
    if (options.tables() == null || options.tables().isEmpty()) {
      return allTables;
    }
    return allTables.stream().filter(table -> table.matches(options.tables())).toList();
  }

  private void requireConfigured() {
    if (!airtableConfig.isConfigured()) {
      throw new SyncConfigurationException(
          "Airtable not configured: set airtable.api-key and airtable.base-id");
    }
  }

  private String resolveTenant(String requested) {
    if (requested != null && !requested.isBlank()) {
      return requested;
    }
    String fallback = airtableConfig.getDefaultTenantId();
    if (fallback == null || fallback.isBlank()) {
      throw new SyncConfigurationException(
          "No tenant for synced records: pass tenantId or set airtable.default-tenant-id");
    }
    return fallback;
  }

  private static void requireTableName(String tableName) {
    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("tableName must not be blank");
    }
  }
}
