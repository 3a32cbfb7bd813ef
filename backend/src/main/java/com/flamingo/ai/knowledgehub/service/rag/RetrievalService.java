package com.flamingo.ai.knowledgehub.service.rag;

import com.flamingo.ai.knowledgehub.config.RagConfig;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunkIndexService;
import com.flamingo.ai.knowledgehub.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Multi-corpus semantic retrieval.
 *
 * <p>The query is embedded once, then every enabled corpus is searched concurrently for the
 * tenant's nearest chunks. Hits are merged by similarity (newer sources win ties), cut to {@code
 * topK} and packed into a token-bounded context. A corpus that fails or times out is dropped and
 * the others still answer; an embedding failure fails the whole retrieval.
 */
@Service
@Slf4j
public class RetrievalService {

  static final int MAX_TOP_K = 100;

  static final Comparator<SourceChunk> RANKING =
      Comparator.comparing(
              (SourceChunk chunk) -> chunk.getSimilarity() != null ? chunk.getSimilarity() : 0.0,
              Comparator.reverseOrder())
          .thenComparing(
              SourceChunk::getLastUpdated, Comparator.nullsLast(Comparator.reverseOrder()));

  private final EmbeddingService embeddingService;
  private final SourceChunkIndexService sourceChunkIndexService;
  private final ContextAssembler contextAssembler;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public RetrievalService(
      EmbeddingService embeddingService,
      SourceChunkIndexService sourceChunkIndexService,
      ContextAssembler contextAssembler,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.embeddingService = embeddingService;
    this.sourceChunkIndexService = sourceChunkIndexService;
    this.contextAssembler = contextAssembler;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  /**
   * Retrieves the most relevant chunks for a query across all enabled corpora.
   *
   * @param query the user query
   * @param options tenant and per-query overrides
   * @return included chunks, the formatted context and its approximate token count
   * @throws com.flamingo.ai.knowledgehub.exception.EmbeddingException if the query cannot be
   *     embedded
   * @throws IllegalArgumentException if the query or tenant is missing, or an option is out of
   *     range
   */
  @Timed(value = "rag.retrieve", description = "Time for multi-corpus retrieval")
  public RetrievalResult retrieve(String query, RetrievalOptions options) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (options == null || options.tenantId() == null || options.tenantId().isBlank()) {
      throw new IllegalArgumentException("tenantId is required for retrieval");
    }
    RagConfig.Retrieval defaults = ragConfig.getRetrieval();
    int topK = options.topK() != null ? options.topK() : defaults.getTopK();
    double threshold =
        options.similarityThreshold() != null
            ? options.similarityThreshold()
            : defaults.getSimilarityThreshold();
    int maxContextTokens =
        options.maxContextTokens() != null
            ? options.maxContextTokens()
            : defaults.getMaxContextTokens();
    validate(topK, threshold, maxContextTokens);

    List<Float> queryEmbedding = embeddingService.embed(query);

    Map<SourceType, CompletableFuture<List<SourceChunk>>> queries = new EnumMap<>(SourceType.class);
    for (SourceType sourceType : enabledCorpora()) {
      List<String> sourceIds = sourceType == SourceType.DOCUMENT ? options.sourceFilter() : null;
      queries.put(
          sourceType,
          queryCorpus(sourceType, options.tenantId(), sourceIds, queryEmbedding, topK, threshold));
    }

    List<SourceChunk> candidates = new ArrayList<>();
    for (Map.Entry<SourceType, CompletableFuture<List<SourceChunk>>> entry : queries.entrySet()) {
      List<SourceChunk> hits = entry.getValue().join();
      log.debug("Corpus {} returned {} hit(s)", entry.getKey().getValue(), hits.size());
      candidates.addAll(hits);
    }

    List<SourceChunk> ranked =
        candidates.stream()
            .filter(chunk -> chunk.getSimilarity() != null && chunk.getSimilarity() > threshold)
            .sorted(RANKING)
            .limit(topK)
            .toList();

    RetrievalResult result = contextAssembler.assemble(ranked, maxContextTokens);
    meterRegistry.counter("rag.retrieve.success").increment();
    log.debug(
        "Retrieved {} candidate(s), {} ranked, {} in context (~{} tokens) for tenant {}",
        candidates.size(),
        ranked.size(),
        result.chunks().size(),
        result.estimatedTokens(),
        options.tenantId());
    return result;
  }

  private CompletableFuture<List<SourceChunk>> queryCorpus(
      SourceType sourceType,
      String tenantId,
      List<String> sourceIds,
      List<Float> queryEmbedding,
      int topK,
      double threshold) {
    return CompletableFuture.supplyAsync(
            () ->
                sourceChunkIndexService.searchCorpus(
                    sourceType, tenantId, sourceIds, queryEmbedding, topK, threshold),
            retrievalExecutor)
        .orTimeout(ragConfig.getRetrieval().getCorpusTimeoutMs(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              log.warn(
                  "Dropping {} corpus from retrieval: {}", sourceType.getValue(), e.toString());
              meterRegistry
                  .counter("rag.retrieve.corpus_failures", "corpus", sourceType.getValue())
                  .increment();
              return List.of();
            });
  }

  private List<SourceType> enabledCorpora() {
    RagConfig.Corpora corpora = ragConfig.getCorpora();
    List<SourceType> enabled = new ArrayList<>();
    if (corpora.isDocuments()) {
      enabled.add(SourceType.DOCUMENT);
    }
    if (corpora.isMeetings()) {
      enabled.add(SourceType.MEETING);
    }
    if (corpora.isTabular()) {
      enabled.add(SourceType.TABULAR);
    }
    return enabled;
  }

  private static void validate(int topK, double threshold, int maxContextTokens) {
    if (topK < 1 || topK > MAX_TOP_K) {
      throw new IllegalArgumentException("topK must be between 1 and " + MAX_TOP_K);
    }
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("similarityThreshold must be within [0, 1]");
    }
    if (maxContextTokens < 1) {
      throw new IllegalArgumentException("maxContextTokens must be at least 1");
    }
  }
}
