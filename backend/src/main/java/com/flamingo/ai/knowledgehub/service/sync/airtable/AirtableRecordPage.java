package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * One page of records.
 *
 * @param records records of this page
 * @param offset continuation token for the next page, null on the last page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirtableRecordPage(List<AirtableRecord> records, String offset) {

  public boolean hasMore() {
    return offset != null && !offset.isBlank();
  }
}
