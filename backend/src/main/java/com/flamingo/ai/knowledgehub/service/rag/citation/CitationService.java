package com.flamingo.ai.knowledgehub.service.rag.citation;

import com.flamingo.ai.knowledgehub.config.RagConfig;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds citations for the chunks in a context and labels how confident the answer can be.
 *
 * <p>Citations are produced one per chunk, in the order the chunks appear in the context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CitationService {

  static final String ELLIPSIS = "...";

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Builds one citation per ranked chunk.
   *
   * @param rankedChunks the chunks included in the context, best first
   * @return citations in the same order
   */
  public List<SourceCitation> buildCitations(List<SourceChunk> rankedChunks) {
    List<SourceCitation> citations = new ArrayList<>(rankedChunks.size());
    for (SourceChunk chunk : rankedChunks) {
      double score = clamp(chunk.getSimilarity());
      citations.add(
          SourceCitation.builder()
              .id(chunk.getId())
              .type(chunk.getSourceType())
              .sourceName(chunk.getSourceName())
              .sourceId(chunk.getSourceId())
              .location(locationOf(chunk))
              .excerpt(excerpt(chunk.getContent()))
              .relevanceScore(score)
              .relevance(RelevanceBand.of(score))
              .lastUpdated(chunk.getLastUpdated())
              .editUrl(chunk.getEditUrl())
              .build());
    }
    return citations;
  }

  /** Display label for a relevance score. */
  public String relevanceLabel(double score) {
    return RelevanceBand.of(score).getLabel();
  }

  /**
   * Labels an answer by its citations.
   *
   * <p>High needs at least {@code minSupportingForHigh} supporting citations (relevance at or
   * above the support threshold) and a best citation at or above the high threshold. Medium needs
   * one supporting citation. Anything else is low.
   */
  public ConfidenceScore buildConfidence(List<SourceCitation> citations) {
    RagConfig.Confidence config = ragConfig.getConfidence();
    double best = 0.0;
    Map<SourceType, Integer> supportingByType = new EnumMap<>(SourceType.class);
    int supporting = 0;
    for (SourceCitation citation : citations) {
      best = Math.max(best, citation.relevanceScore());
      if (citation.relevanceScore() >= config.getSupportThreshold()) {
        supporting++;
        supportingByType.merge(citation.type(), 1, Integer::sum);
      }
    }

    ConfidenceLevel level;
    if (supporting >= config.getMinSupportingForHigh() && best >= config.getHighThreshold()) {
      level = ConfidenceLevel.HIGH;
    } else if (supporting >= 1) {
      level = ConfidenceLevel.MEDIUM;
    } else {
      level = ConfidenceLevel.LOW;
    }
    meterRegistry.counter("rag.confidence", "level", level.getValue()).increment();

    String explanation = explain(citations.size(), supporting, supportingByType, best);
    log.debug("Confidence {} (best={}, supporting={})", level, best, supporting);
    return new ConfidenceScore(level, best, supporting, explanation);
  }

  CitationLocation locationOf(SourceChunk chunk) {
    SourceType type = chunk.getSourceType();
    if (type == SourceType.DOCUMENT && chunk.getPageNumber() != null) {
      return CitationLocation.page(chunk.getPageNumber());
    }
    if (type == SourceType.MEETING && chunk.getTimestamp() != null) {
      return CitationLocation.timestamp(chunk.getTimestamp());
    }
    if (type == SourceType.TABULAR && chunk.getFieldKey() != null) {
      return CitationLocation.field(chunk.getFieldKey());
    }
    return CitationLocation.chunk(chunk.getChunkIndex());
  }

  String excerpt(String content) {
    if (content == null) {
      return "";
    }
    int limit = ragConfig.getCitation().getExcerptLength();
    if (content.length() <= limit) {
      return content;
    }
    return content.substring(0, limit) + ELLIPSIS;
  }

  private static double clamp(Double similarity) {
    if (similarity == null) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, similarity));
  }

  private static String explain(
      int total, int supporting, Map<SourceType, Integer> supportingByType, double best) {
    if (total == 0) {
      return "No relevant sources were found.";
    }
    if (supporting == 0) {
      return String.format(
          Locale.ROOT,
          "None of the %d cited source%s is a strong match (best relevance %.2f).",
          total,
          total == 1 ? "" : "s",
          best);
    }
    List<String> mix = new ArrayList<>();
    for (Map.Entry<SourceType, Integer> entry : supportingByType.entrySet()) {
      int count = entry.getValue();
      mix.add(count + " " + entry.getKey().getLabel() + (count == 1 ? "" : "s"));
    }
    return String.format(
        Locale.ROOT,
        "Supported by %d source%s (%s), best relevance %.2f.",
        supporting,
        supporting == 1 ? "" : "s",
        String.join(", ", mix),
        best);
  }
}
