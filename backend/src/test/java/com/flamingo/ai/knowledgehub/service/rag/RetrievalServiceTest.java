package com.flamingo.ai.knowledgehub.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgehub.config.RagConfig;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunkIndexService;
import com.flamingo.ai.knowledgehub.exception.EmbeddingException;
import com.flamingo.ai.knowledgehub.exception.SearchException;
import com.flamingo.ai.knowledgehub.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalService Tests")
class RetrievalServiceTest {

  private static final String TENANT = "tenant-1";
  private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f);

  @Mock private EmbeddingService embeddingService;
  @Mock private SourceChunkIndexService indexService;

  private final Executor directExecutor = Runnable::run;
  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private RetrievalService retrievalService;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    retrievalService =
        new RetrievalService(
            embeddingService,
            indexService,
            new ContextAssembler(),
            ragConfig,
            meterRegistry,
            directExecutor);
    lenient().when(embeddingService.embed(any())).thenReturn(QUERY_VECTOR);
  }

  @Test
  @DisplayName("Should exclude chunks at or below the similarity threshold")
  void shouldApplyStrictThreshold() {
    stubCorpus(
        SourceType.DOCUMENT,
        chunk("d1", SourceType.DOCUMENT, 0.70),
        chunk("d2", SourceType.DOCUMENT, 0.71));
    stubCorpus(SourceType.MEETING);
    stubCorpus(SourceType.TABULAR, chunk("t1", SourceType.TABULAR, 0.69));

    RetrievalResult result = retrievalService.retrieve("query", RetrievalOptions.forTenant(TENANT));

    assertThat(result.chunks()).extracting(SourceChunk::getId).containsExactly("d2");
  }

  @Test
  @DisplayName("Should merge corpora by similarity with newer sources first on ties")
  void shouldMergeAndRank() {
    Instant older = Instant.parse("2024-01-01T00:00:00Z");
    Instant newer = Instant.parse("2024-06-01T00:00:00Z");
    SourceChunk docOld = chunk("doc-old", SourceType.DOCUMENT, 0.80);
    docOld.setLastUpdated(older);
    SourceChunk meetingNew = chunk("meeting-new", SourceType.MEETING, 0.80);
    meetingNew.setLastUpdated(newer);
    stubCorpus(SourceType.DOCUMENT, docOld, chunk("doc-best", SourceType.DOCUMENT, 0.95));
    stubCorpus(SourceType.MEETING, meetingNew);
    stubCorpus(SourceType.TABULAR, chunk("row", SourceType.TABULAR, 0.88));

    RetrievalResult result = retrievalService.retrieve("query", RetrievalOptions.forTenant(TENANT));

    assertThat(result.chunks())
        .extracting(SourceChunk::getId)
        .containsExactly("doc-best", "row", "meeting-new", "doc-old");
  }

  @Test
  @DisplayName("Should cut the merged list to topK")
  void shouldLimitToTopK() {
    stubCorpus(
        SourceType.DOCUMENT,
        chunk("a", SourceType.DOCUMENT, 0.91),
        chunk("b", SourceType.DOCUMENT, 0.90));
    stubCorpus(SourceType.MEETING, chunk("c", SourceType.MEETING, 0.95));
    stubCorpus(SourceType.TABULAR, chunk("d", SourceType.TABULAR, 0.75));

    RetrievalOptions options = RetrievalOptions.builder().tenantId(TENANT).topK(2).build();
    RetrievalResult result = retrievalService.retrieve("query", options);

    assertThat(result.chunks()).extracting(SourceChunk::getId).containsExactly("c", "a");
  }

  @Test
  @DisplayName("Should stop adding context entries once the token budget is reached")
  void shouldRespectContextBudget() {
    SourceChunk first = chunk("first", SourceType.DOCUMENT, 0.95);
    first.setContent("a".repeat(30));
    SourceChunk second = chunk("second", SourceType.DOCUMENT, 0.90);
    second.setContent("b".repeat(30));
    stubCorpus(SourceType.DOCUMENT, first, second);
    stubCorpus(SourceType.MEETING);
    stubCorpus(SourceType.TABULAR);

    // "[Report]: " + 30 chars = 40 chars = 10 tokens; the second entry would need 42 more chars
    RetrievalOptions options =
        RetrievalOptions.builder().tenantId(TENANT).maxContextTokens(15).build();
    RetrievalResult result = retrievalService.retrieve("query", options);

    assertThat(result.chunks()).extracting(SourceChunk::getId).containsExactly("first");
    assertThat(result.context()).isEqualTo("[Report]: " + "a".repeat(30));
    assertThat(result.estimatedTokens()).isEqualTo(10);
  }

  @Test
  @DisplayName("Should always include the best chunk even when it alone exceeds the budget")
  void shouldAlwaysIncludeFirstChunk() {
    SourceChunk big = chunk("big", SourceType.DOCUMENT, 0.95);
    big.setContent("x".repeat(400));
    stubCorpus(SourceType.DOCUMENT, big);
    stubCorpus(SourceType.MEETING);
    stubCorpus(SourceType.TABULAR);

    RetrievalOptions options =
        RetrievalOptions.builder().tenantId(TENANT).maxContextTokens(10).build();
    RetrievalResult result = retrievalService.retrieve("query", options);

    assertThat(result.chunks()).hasSize(1);
    assertThat(result.context()).startsWith("[Report]: xxx");
  }

  @Test
  @DisplayName("Should drop a failing corpus and still answer from the others")
  void shouldDegradeWhenCorpusFails() {
    when(indexService.searchCorpus(
            eq(SourceType.DOCUMENT), eq(TENANT), any(), anyList(), anyInt(), anyDouble()))
        .thenThrow(new SearchException("index unavailable"));
    stubCorpus(SourceType.MEETING, chunk("m1", SourceType.MEETING, 0.82));
    stubCorpus(SourceType.TABULAR, chunk("t1", SourceType.TABULAR, 0.86));

    RetrievalResult result = retrievalService.retrieve("query", RetrievalOptions.forTenant(TENANT));

    assertThat(result.chunks()).extracting(SourceChunk::getId).containsExactly("t1", "m1");
    assertThat(
            meterRegistry
                .counter("rag.retrieve.corpus_failures", "corpus", "document")
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should fail retrieval when the query cannot be embedded")
  void shouldPropagateEmbeddingFailure() {
    when(embeddingService.embed("query"))
        .thenThrow(new EmbeddingException("down", new RuntimeException("503")));

    assertThatThrownBy(
            () -> retrievalService.retrieve("query", RetrievalOptions.forTenant(TENANT)))
        .isInstanceOf(EmbeddingException.class);
    verifyNoInteractions(indexService);
  }

  @Test
  @DisplayName("Should restrict only the document corpus to the source filter")
  void shouldApplySourceFilterToDocumentsOnly() {
    List<String> filter = List.of("doc-42");
    when(indexService.searchCorpus(
            eq(SourceType.DOCUMENT), eq(TENANT), eq(filter), anyList(), anyInt(), anyDouble()))
        .thenReturn(List.of());
    when(indexService.searchCorpus(
            eq(SourceType.MEETING), eq(TENANT), isNull(), anyList(), anyInt(), anyDouble()))
        .thenReturn(List.of());
    when(indexService.searchCorpus(
            eq(SourceType.TABULAR), eq(TENANT), isNull(), anyList(), anyInt(), anyDouble()))
        .thenReturn(List.of());

    RetrievalOptions options =
        RetrievalOptions.builder().tenantId(TENANT).sourceFilter(filter).build();
    RetrievalResult result = retrievalService.retrieve("query", options);

    assertThat(result.isEmpty()).isTrue();
    assertThat(result.context()).isEmpty();
  }

  @Test
  @DisplayName("Should skip disabled corpora")
  void shouldSkipDisabledCorpora() {
    ragConfig.getCorpora().setMeetings(false);
    ragConfig.getCorpora().setTabular(false);
    stubCorpus(SourceType.DOCUMENT, chunk("d1", SourceType.DOCUMENT, 0.9));

    retrievalService.retrieve("query", RetrievalOptions.forTenant(TENANT));

    verify(indexService, never())
        .searchCorpus(eq(SourceType.MEETING), any(), any(), anyList(), anyInt(), anyDouble());
    verify(indexService, never())
        .searchCorpus(eq(SourceType.TABULAR), any(), any(), anyList(), anyInt(), anyDouble());
  }

  @Test
  @DisplayName("Should reject a request without tenant")
  void shouldRequireTenant() {
    assertThatThrownBy(
            () -> retrievalService.retrieve("query", RetrievalOptions.builder().build()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tenantId");
    verifyNoInteractions(embeddingService, indexService);
  }

  @Test
  @DisplayName("Should reject a topK outside 1..100 before touching any corpus")
  void shouldRejectOutOfRangeTopK() {
    RetrievalOptions tooMany = RetrievalOptions.builder().tenantId(TENANT).topK(101).build();
    RetrievalOptions none = RetrievalOptions.builder().tenantId(TENANT).topK(0).build();

    assertThatThrownBy(() -> retrievalService.retrieve("query", tooMany))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("topK");
    assertThatThrownBy(() -> retrievalService.retrieve("query", none))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(embeddingService, indexService);
  }

  @Test
  @DisplayName("Should accept the largest allowed topK")
  void shouldAcceptMaxTopK() {
    stubCorpus(SourceType.DOCUMENT, chunk("a", SourceType.DOCUMENT, 0.91));
    stubCorpus(SourceType.MEETING);
    stubCorpus(SourceType.TABULAR);

    RetrievalOptions options =
        RetrievalOptions.builder().tenantId(TENANT).topK(RetrievalService.MAX_TOP_K).build();

    assertThat(retrievalService.retrieve("query", options).chunks()).hasSize(1);
  }

  private void stubCorpus(SourceType type, SourceChunk... chunks) {
    when(indexService.searchCorpus(
            eq(type), eq(TENANT), any(), anyList(), anyInt(), anyDouble()))
        .thenReturn(List.of(chunks));
  }

  static SourceChunk chunk(String id, SourceType type, double similarity) {
    return SourceChunk.builder()
        .id(id)
        .sourceType(type)
        .tenantId(TENANT)
        .sourceId(id + "-source")
        .sourceName("Report")
        .content("content of " + id)
        .similarity(similarity)
        .build();
  }
}
