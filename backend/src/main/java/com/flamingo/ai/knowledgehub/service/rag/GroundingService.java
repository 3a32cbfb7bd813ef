package com.flamingo.ai.knowledgehub.service.rag;

import com.flamingo.ai.knowledgehub.exception.EmbeddingException;
import com.flamingo.ai.knowledgehub.exception.SearchException;
import com.flamingo.ai.knowledgehub.service.rag.citation.CitationService;
import com.flamingo.ai.knowledgehub.service.rag.citation.ConfidenceScore;
import com.flamingo.ai.knowledgehub.service.rag.citation.SourceCitation;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieval plus citations for the chat flow. Retrieval failures never block the caller; they
 * degrade to an ungrounded result with low confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroundingService {

  private final RetrievalService retrievalService;
  private final CitationService citationService;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.ground", description = "Time to retrieve and cite sources")
  public GroundedContext ground(String query, RetrievalOptions options) {
    RetrievalResult result;
    try {
      result = retrievalService.retrieve(query, options);
    } catch (EmbeddingException | SearchException e) {
      log.warn("Retrieval failed, continuing without grounding: {}", e.getMessage());
      meterRegistry.counter("rag.ground.degraded").increment();
      return GroundedContext.ungrounded("Sources could not be searched for this question.");
    }

    List<SourceCitation> citations = citationService.buildCitations(result.chunks());
    ConfidenceScore confidence = citationService.buildConfidence(citations);
    return new GroundedContext(
        result.context(), result.estimatedTokens(), citations, confidence, !result.isEmpty());
  }
}
