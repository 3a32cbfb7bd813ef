package com.flamingo.ai.knowledgehub.api.dto.request;

import com.flamingo.ai.knowledgehub.service.rag.RetrievalOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for grounding a query in the tenant's sources. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must be at most 10000 characters")
  private String query;

  @NotBlank(message = "Tenant id is required")
  private String tenantId;

  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 50, message = "topK must be at most 50")
  private Integer topK;

  @DecimalMin(value = "0.0", message = "similarityThreshold must be at least 0")
  @DecimalMax(value = "1.0", message = "similarityThreshold must be at most 1")
  private Double similarityThreshold;

  /** Document ids the document corpus is restricted to. */
  private List<String> sourceFilter;

  @Min(value = 1, message = "maxContextTokens must be at least 1")
  private Integer maxContextTokens;

  public RetrievalOptions toOptions() {
    return RetrievalOptions.builder()
        .tenantId(tenantId)
        .topK(topK)
        .similarityThreshold(similarityThreshold)
        .sourceFilter(sourceFilter)
        .maxContextTokens(maxContextTokens)
        .build();
  }
}
