package com.flamingo.ai.knowledgehub.service.rag.citation;

/**
 * Confidence label for a grounded answer.
 *
 * @param level high, medium or low
 * @param score best citation relevance, 0 when there are no citations
 * @param supportingSources number of citations at or above the support threshold
 * @param explanation one sentence naming the supporting sources
 */
public record ConfidenceScore(
    ConfidenceLevel level, double score, int supportingSources, String explanation) {}
