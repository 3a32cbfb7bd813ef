package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.flamingo.ai.knowledgehub.exception.TabularSourceException;
import java.util.List;
import java.util.Map;

/**
 * Access to the external tabular source. All methods throw {@link TabularSourceException} when
 * the source rejects the call or cannot be reached.
 */
public interface TabularSourceClient {

  /** Lists the tables of the configured base. */
  List<AirtableTable> listTables();

  /**
   * Fetches one page of a table.
   *
   * @param tableId table id or name
   * @param pageSize records per page
   * @param offset continuation token from the previous page, null for the first page
   */
  AirtableRecordPage listRecords(String tableId, int pageSize, String offset);

  /** Fetches every record of a table, following continuation tokens until the last page. */
  List<AirtableRecord> listAllRecords(String tableId);

  /** Creates a record, letting the source coerce field values to the column types. */
  AirtableRecord createRecord(String table, Map<String, Object> fields);

  /** Updates the given fields of a record, with the same coercion as {@link #createRecord}. */
  AirtableRecord updateRecord(String table, String recordId, Map<String, Object> fields);

  /** Link to the record in the source's own UI. */
  String recordUrl(String tableId, String recordId);
}
