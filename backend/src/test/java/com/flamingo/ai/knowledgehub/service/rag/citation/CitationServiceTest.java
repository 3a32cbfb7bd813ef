package com.flamingo.ai.knowledgehub.service.rag.citation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgehub.config.RagConfig;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("CitationService Tests")
class CitationServiceTest {

  private CitationService citationService;

  @BeforeEach
  void setUp() {
    citationService = new CitationService(new RagConfig(), new SimpleMeterRegistry());
  }

  @Nested
  @DisplayName("buildCitations")
  class BuildCitations {

    @Test
    @DisplayName("Should build one citation per chunk in context order")
    void shouldKeepOrder() {
      List<SourceCitation> citations =
          citationService.buildCitations(
              List.of(
                  chunk("c1", SourceType.DOCUMENT, 0.92),
                  chunk("c2", SourceType.TABULAR, 0.81)));

      assertThat(citations).extracting(SourceCitation::id).containsExactly("c1", "c2");
      assertThat(citations).extracting(SourceCitation::relevanceScore).containsExactly(0.92, 0.81);
    }

    @Test
    @DisplayName("Should cut excerpts to 200 characters with an ellipsis")
    void shouldTruncateExcerpt() {
      SourceChunk longChunk = chunk("c1", SourceType.DOCUMENT, 0.9);
      longChunk.setContent("y".repeat(250));
      SourceChunk shortChunk = chunk("c2", SourceType.DOCUMENT, 0.9);
      shortChunk.setContent("short text");

      List<SourceCitation> citations =
          citationService.buildCitations(List.of(longChunk, shortChunk));

      assertThat(citations.get(0).excerpt()).isEqualTo("y".repeat(200) + "...");
      assertThat(citations.get(1).excerpt()).isEqualTo("short text");
    }

    @Test
    @DisplayName("Should locate chunks by page, timestamp, field or chunk index")
    void shouldPickLocationByType() {
      SourceChunk document = chunk("d", SourceType.DOCUMENT, 0.9);
      document.setPageNumber(4);
      SourceChunk meeting = chunk("m", SourceType.MEETING, 0.9);
      meeting.setTimestamp("00:12:45");
      SourceChunk tabular = chunk("t", SourceType.TABULAR, 0.9);
      tabular.setFieldKey("Deal Name");
      SourceChunk pageless = chunk("p", SourceType.DOCUMENT, 0.9);
      pageless.setChunkIndex(2);

      List<SourceCitation> citations =
          citationService.buildCitations(List.of(document, meeting, tabular, pageless));

      assertThat(citations)
          .extracting(SourceCitation::location)
          .containsExactly(
              CitationLocation.page(4),
              CitationLocation.timestamp("00:12:45"),
              CitationLocation.field("Deal Name"),
              CitationLocation.chunk(2));
      assertThat(citations.get(0).location().label()).isEqualTo("Page 4");
      assertThat(citations.get(3).location().label()).isEqualTo("Section 3");
    }

    @Test
    @DisplayName("Should carry provenance fields through")
    void shouldCarryProvenance() {
      Instant updated = Instant.parse("2024-05-01T10:00:00Z");
      SourceChunk tabular = chunk("t", SourceType.TABULAR, 0.88);
      tabular.setEditUrl("https://airtable.com/app1/tbl1/rec1");
      tabular.setLastUpdated(updated);

      SourceCitation citation = citationService.buildCitations(List.of(tabular)).get(0);

      assertThat(citation.type()).isEqualTo(SourceType.TABULAR);
      assertThat(citation.sourceId()).isEqualTo("t-source");
      assertThat(citation.editUrl()).isEqualTo("https://airtable.com/app1/tbl1/rec1");
      assertThat(citation.lastUpdated()).isEqualTo(updated);
      assertThat(citation.relevance()).isEqualTo(RelevanceBand.GOOD_MATCH);
    }
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "0.95, High match",
    "0.90, High match",
    "0.85, Good match",
    "0.80, Good match",
    "0.75, Relevant",
    "0.70, Relevant",
    "0.69, Partial match",
    "0.10, Partial match"
  })
  @DisplayName("Should label relevance bands")
  void shouldLabelRelevance(double score, String label) {
    assertThat(citationService.relevanceLabel(score)).isEqualTo(label);
  }

  @Nested
  @DisplayName("buildConfidence")
  class BuildConfidence {

    @Test
    @DisplayName("Should rate a strong document plus a good tabular record as high")
    void shouldRateQuarterlyRevenueAnswerHigh() {
      List<SourceCitation> citations =
          citationService.buildCitations(
              List.of(
                  chunk("report", SourceType.DOCUMENT, 0.92),
                  chunk("deal", SourceType.TABULAR, 0.81)));

      ConfidenceScore confidence = citationService.buildConfidence(citations);

      assertThat(confidence.level()).isEqualTo(ConfidenceLevel.HIGH);
      assertThat(confidence.score()).isEqualTo(0.92);
      assertThat(confidence.supportingSources()).isEqualTo(2);
      assertThat(confidence.explanation())
          .isEqualTo("Supported by 2 sources (1 document, 1 tabular record), best relevance 0.92.");
    }

    @Test
    @DisplayName("Should rate a single supporting citation as medium")
    void shouldRateSingleSupportMedium() {
      ConfidenceScore confidence =
          citationService.buildConfidence(
              citationService.buildCitations(
                  List.of(
                      chunk("a", SourceType.MEETING, 0.95), chunk("b", SourceType.MEETING, 0.5))));

      assertThat(confidence.level()).isEqualTo(ConfidenceLevel.MEDIUM);
      assertThat(confidence.supportingSources()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should rate two supporting citations without a strong one as medium")
    void shouldRequireStrongBestForHigh() {
      ConfidenceScore confidence =
          citationService.buildConfidence(
              citationService.buildCitations(
                  List.of(
                      chunk("a", SourceType.DOCUMENT, 0.84),
                      chunk("b", SourceType.DOCUMENT, 0.80))));

      assertThat(confidence.level()).isEqualTo(ConfidenceLevel.MEDIUM);
      assertThat(confidence.explanation()).contains("2 documents");
    }

    @Test
    @DisplayName("Should rate no citations as low with score zero")
    void shouldRateEmptyLow() {
      ConfidenceScore confidence = citationService.buildConfidence(List.of());

      assertThat(confidence.level()).isEqualTo(ConfidenceLevel.LOW);
      assertThat(confidence.score()).isZero();
      assertThat(confidence.supportingSources()).isZero();
      assertThat(confidence.explanation()).isEqualTo("No relevant sources were found.");
    }

    @Test
    @DisplayName("Should rate only weak citations as low")
    void shouldRateWeakLow() {
      ConfidenceScore confidence =
          citationService.buildConfidence(
              citationService.buildCitations(List.of(chunk("a", SourceType.DOCUMENT, 0.6))));

      assertThat(confidence.level()).isEqualTo(ConfidenceLevel.LOW);
      assertThat(confidence.score()).isEqualTo(0.6);
    }
  }

  private static SourceChunk chunk(String id, SourceType type, double similarity) {
    return SourceChunk.builder()
        .id(id)
        .sourceType(type)
        .sourceId(id + "-source")
        .sourceName("Source " + id)
        .content("content of " + id)
        .similarity(similarity)
        .build();
  }
}
