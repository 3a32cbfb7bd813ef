package com.flamingo.ai.knowledgehub.api.dto.request;

import com.flamingo.ai.knowledgehub.service.sync.SyncOptions;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a sync run; every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

  /** Table names or ids; empty syncs all tables. */
  private List<String> tables;

  private Boolean embedRecords;

  private String tenantId;

  public SyncOptions toOptions() {
    return new SyncOptions(tables, embedRecords, tenantId);
  }
}
