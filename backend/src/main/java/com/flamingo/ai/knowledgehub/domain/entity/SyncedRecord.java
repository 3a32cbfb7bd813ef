package com.flamingo.ai.knowledgehub.domain.entity;

import com.flamingo.ai.knowledgehub.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A record pulled from the tabular source. Identified by the composite natural key {@code
 * (externalId, baseId, tableId)}; a re-sync of the same external record updates this row in
 * place.
 */
@Entity
@Table(
    name = "synced_records",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_synced_records_external",
            columnNames = {"external_id", "base_id", "table_id"}),
    indexes = {
      @Index(name = "idx_synced_records_table", columnList = "table_name, source"),
      @Index(name = "idx_synced_records_tenant", columnList = "tenant_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncedRecord {

  public static final String SOURCE_AIRTABLE = "airtable";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "external_id", nullable = false)
  private String externalId;

  @Column(name = "base_id", nullable = false)
  private String baseId;

  @Column(name = "table_id", nullable = false)
  private String tableId;

  @Column(name = "table_name", nullable = false)
  private String tableName;

  @Column(nullable = false)
  @Builder.Default
  private String source = SOURCE_AIRTABLE;

  /** Tenant that owns the record; retrieval only returns records of the requesting tenant. */
  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> fields = new LinkedHashMap<>();

  /** Name of the table's primary field at sync time; labels the record in citations. */
  private String primaryField;

  private Instant createdAtSource;

  @Column(nullable = false)
  private Instant syncedAt;

  /** When the record's vector was last written to the chunk index; null if never embedded. */
  private Instant embeddedAt;

  /** Deterministic id of this record's chunk in the vector index. */
  public String chunkId() {
    return chunkId(tenantId, baseId, tableId, externalId);
  }

  /** Builds the deterministic chunk id of a tabular record owned by a tenant. */
  public static String chunkId(
      String tenantId, String baseId, String tableId, String externalId) {
    return tenantId + "_" + baseId + "_" + tableId + "_" + externalId;
  }

  /** Overwrites the source-owned columns with the latest copy from the source. */
  public void refreshFrom(
      String tableName,
      String primaryField,
      Map<String, Object> fields,
      Instant createdAtSource,
      String tenantId) {
    this.tableName = tableName;
    this.primaryField = primaryField;
    this.fields = new LinkedHashMap<>(fields);
    this.createdAtSource = createdAtSource;
    this.tenantId = tenantId;
    this.syncedAt = Instant.now();
  }

  /** Marks the record as embedded now. */
  public void markEmbedded() {
    this.embeddedAt = Instant.now();
  }
}
