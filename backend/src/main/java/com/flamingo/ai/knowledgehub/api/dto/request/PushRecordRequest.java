package com.flamingo.ai.knowledgehub.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for writing one record back to the tabular source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushRecordRequest {

  @NotBlank(message = "Table name is required")
  private String tableName;

  /** Record to update; omit to create a new record. */
  private String recordId;

  @NotEmpty(message = "At least one field is required")
  private Map<String, Object> fields;
}
