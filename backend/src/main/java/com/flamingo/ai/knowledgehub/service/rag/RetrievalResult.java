package com.flamingo.ai.knowledgehub.service.rag;

import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import java.util.List;

/**
 * Outcome of one retrieval.
 *
 * @param chunks the chunks that made it into the context, best first
 * @param context the formatted context handed to the generation model
 * @param estimatedTokens approximate token count of {@code context} (characters / 4)
 */
public record RetrievalResult(List<SourceChunk> chunks, String context, int estimatedTokens) {

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of(), "", 0);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
