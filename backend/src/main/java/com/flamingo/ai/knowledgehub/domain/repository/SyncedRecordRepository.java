package com.flamingo.ai.knowledgehub.domain.repository;

import com.flamingo.ai.knowledgehub.domain.entity.SyncedRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for records synced from the tabular source. */
@Repository
public interface SyncedRecordRepository extends JpaRepository<SyncedRecord, UUID> {

  /** Finds a record by its composite natural key. */
  Optional<SyncedRecord> findByExternalIdAndBaseIdAndTableId(
      String externalId, String baseId, String tableId);

  /** Finds all records of one table from one source. */
  List<SyncedRecord> findByTableNameAndSourceOrderBySyncedAtAsc(String tableName, String source);

  /** Tenants owning at least one record of the table. */
  @Query(
      "SELECT DISTINCT r.tenantId FROM SyncedRecord r "
          + "WHERE r.tableName = :tableName AND r.source = :source")
  List<String> findTenantIdsByTableNameAndSource(
      @Param("tableName") String tableName, @Param("source") String source);

  /** Counts records of one source. */
  long countBySource(String source);

  /** Deletes all records of one table from one source and returns how many were removed. */
  @Modifying
  @Query("DELETE FROM SyncedRecord r WHERE r.tableName = :tableName AND r.source = :source")
  int deleteByTableNameAndSource(
      @Param("tableName") String tableName, @Param("source") String source);

  /** Record count per table for one source. */
  @Query(
      "SELECT r.tableName AS tableName, COUNT(r) AS recordCount FROM SyncedRecord r "
          + "WHERE r.source = :source GROUP BY r.tableName ORDER BY r.tableName")
  List<TableRecordCount> countByTable(@Param("source") String source);

  /** Projection for {@link #countByTable(String)}. */
  interface TableRecordCount {
    String getTableName();

    long getRecordCount();
  }
}
