package com.flamingo.ai.knowledgehub.service.rag.citation;

import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import java.time.Instant;
import lombok.Builder;

/** Provenance of one chunk that was handed to the generation model. */
@Builder
public record SourceCitation(
    String id,
    SourceType type,
    String sourceName,
    String sourceId,
    CitationLocation location,
    String excerpt,
    double relevanceScore,
    RelevanceBand relevance,
    Instant lastUpdated,
    String editUrl) {}
