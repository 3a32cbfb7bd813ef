package com.flamingo.ai.knowledgehub.service.rag;

import java.util.List;
import lombok.Builder;

/**
 * Per-query retrieval options. Unset numeric options fall back to the {@code rag.retrieval.*}
 * defaults.
 *
 * @param tenantId tenant whose sources may be searched; required
 * @param topK maximum number of chunks returned
 * @param similarityThreshold chunks must be strictly more similar than this
 * @param sourceFilter document ids the document corpus is restricted to; ignored by the other
 *     corpora
 * @param maxContextTokens approximate token budget of the assembled context
 */
@Builder
public record RetrievalOptions(
    String tenantId,
    Integer topK,
    Double similarityThreshold,
    List<String> sourceFilter,
    Integer maxContextTokens) {

  public static RetrievalOptions forTenant(String tenantId) {
    return RetrievalOptions.builder().tenantId(tenantId).build();
  }
}
