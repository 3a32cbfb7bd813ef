package com.flamingo.ai.knowledgehub.service.rag;

import com.flamingo.ai.knowledgehub.service.rag.citation.ConfidenceLevel;
import com.flamingo.ai.knowledgehub.service.rag.citation.ConfidenceScore;
import com.flamingo.ai.knowledgehub.service.rag.citation.SourceCitation;
import java.util.List;

/**
 * Everything the chat flow needs to ground a generation call.
 *
 * @param context formatted context, empty when nothing was found
 * @param estimatedTokens approximate token count of {@code context}
 * @param citations one citation per chunk in {@code context}, same order
 * @param confidence confidence label derived from the citations
 * @param grounded whether any source made it into the context
 */
public record GroundedContext(
    String context,
    int estimatedTokens,
    List<SourceCitation> citations,
    ConfidenceScore confidence,
    boolean grounded) {

  static GroundedContext ungrounded(String explanation) {
    return new GroundedContext(
        "", 0, List.of(), new ConfidenceScore(ConfidenceLevel.LOW, 0.0, 0, explanation), false);
  }
}
