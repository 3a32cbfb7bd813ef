package com.flamingo.ai.knowledgehub.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link SourceChunk} documents of all three corpora.
 *
 * <p>Every query is scoped by tenant and source type. The document corpus can additionally be
 * narrowed to an allow-list of source ids.
 */
@Service
@Slf4j
public class SourceChunkIndexService extends AbstractElasticsearchIndexService<SourceChunk> {

  public static final String TENANT_ID = "tenantId";
  public static final String SOURCE_TYPE = "sourceType";
  public static final String SOURCE_ID = "sourceId";
  public static final String SOURCE_IDS = "sourceIds";
  public static final String COLLECTION = "collection";

  /** Largest {@code num_candidates} Elasticsearch accepts for a kNN query. */
  static final int MAX_NUM_CANDIDATES = 10_000;

  private static final List<String> TERM_CRITERIA =
      List.of(TENANT_ID, SOURCE_TYPE, SOURCE_ID, COLLECTION);

  @Value("${app.elasticsearch.index-name:knowledgehub-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.num-candidates-multiplier:4}")
  private int numCandidatesMultiplier;

  @Autowired
  public SourceChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public SourceChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.numCandidatesMultiplier = 4;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // filter fields MUST be keyword type for exact matching
    properties.put(TENANT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(SOURCE_TYPE, Property.of(p -> p.keyword(k -> k)));
    properties.put(SOURCE_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(COLLECTION, Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("timestamp", Property.of(p -> p.keyword(k -> k)));
    properties.put("fieldKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("editUrl", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("lastUpdated", Property.of(p -> p.date(d -> d)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(SourceChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(TENANT_ID, chunk.getTenantId());
    document.put(SOURCE_TYPE, chunk.getSourceType().getValue());
    document.put(SOURCE_ID, chunk.getSourceId());
    document.put("sourceName", chunk.getSourceName());
    document.put("content", chunk.getContent());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("embedding", chunk.getEmbedding());
    if (chunk.getCollection() != null) {
      document.put(COLLECTION, chunk.getCollection());
    }
    if (chunk.getPageNumber() != null) {
      document.put("pageNumber", chunk.getPageNumber());
    }
    if (chunk.getTimestamp() != null) {
      document.put("timestamp", chunk.getTimestamp());
    }
    if (chunk.getFieldKey() != null) {
      document.put("fieldKey", chunk.getFieldKey());
    }
    if (chunk.getEditUrl() != null) {
      document.put("editUrl", chunk.getEditUrl());
    }
    if (chunk.getLastUpdated() != null) {
      document.put("lastUpdated", chunk.getLastUpdated().toString());
    }
    return document;
  }

  @Override
  protected SourceChunk convertFromDocument(Map<String, Object> source) {
    SourceChunk.SourceChunkBuilder builder =
        SourceChunk.builder()
            .id((String) source.get("id"))
            .tenantId((String) source.get(TENANT_ID))
            .sourceType(SourceType.fromValue((String) source.get(SOURCE_TYPE)))
            .sourceId((String) source.get(SOURCE_ID))
            .sourceName((String) source.get("sourceName"))
            .collection((String) source.get(COLLECTION))
            .content((String) source.get("content"))
            .timestamp((String) source.get("timestamp"))
            .fieldKey((String) source.get("fieldKey"))
            .editUrl((String) source.get("editUrl"));

    if (source.get("chunkIndex") instanceof Number n) {
      builder.chunkIndex(n.intValue());
    }
    if (source.get("pageNumber") instanceof Number n) {
      builder.pageNumber(n.intValue());
    }
    if (source.get("lastUpdated") instanceof String s) {
      builder.lastUpdated(Instant.parse(s));
    }
    return builder.build();
  }

  @Override
  protected String getDocumentId(SourceChunk entity) {
    return entity.getId();
  }

  /** Elasticsearch scores cosine kNN hits as {@code (1 + cos) / 2}. */
  @Override
  protected double scoreToSimilarity(double score) {
    return 2.0 * score - 1.0;
  }

  @Override
  protected SearchRequest buildSimilaritySearchRequest(
      Map<String, Object> filterCriteria,
      List<Float> queryEmbedding,
      int topK,
      double minSimilarity) {
    if (filterCriteria.get(TENANT_ID) == null || filterCriteria.get(SOURCE_TYPE) == null) {
      throw new IllegalArgumentException(
          "tenantId and sourceType filters are required for similarity search");
    }
    Query filter = buildFilter(filterCriteria);
    int numCandidates =
        Math.min(MAX_NUM_CANDIDATES, Math.max(topK, topK * numCandidatesMultiplier));

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(numCandidates)
                            .similarity((float) minSimilarity)
                            .filter(filter))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    boolean scoped = criteria.get(SOURCE_ID) != null || criteria.get(COLLECTION) != null;
    if (!scoped || criteria.get(TENANT_ID) == null || criteria.get(SOURCE_TYPE) == null) {
      throw new IllegalArgumentException(
          "deleteBy requires tenantId, sourceType and at least one of sourceId or collection");
    }
    return buildFilter(criteria);
  }

  private Query buildFilter(Map<String, Object> criteria) {
    List<Query> filters = new ArrayList<>();
    for (String key : TERM_CRITERIA) {
      Object value = criteria.get(key);
      if (value != null) {
        String term = value instanceof SourceType type ? type.getValue() : value.toString();
        filters.add(Query.of(q -> q.term(t -> t.field(key).value(term))));
      }
    }
    if (criteria.get(SOURCE_IDS) instanceof Collection<?> ids && !ids.isEmpty()) {
      List<FieldValue> values = ids.stream().map(id -> FieldValue.of(id.toString())).toList();
      filters.add(
          Query.of(q -> q.terms(t -> t.field(SOURCE_ID).terms(tt -> tt.value(values)))));
    }
    return Query.of(q -> q.bool(b -> b.filter(filters)));
  }

  @Override
  protected String getMetricPrefix() {
    return "source_chunk";
  }

  /** Indexes chunks, overwriting any chunk with the same id. */
  public void indexChunks(List<SourceChunk> chunks) {
    indexDocuments(chunks);
  }

  /**
   * Nearest chunks of one corpus for one tenant.
   *
   * @param sourceType the corpus
   * @param tenantId the requesting tenant
   * @param sourceIds optional allow-list of source ids; null or empty means no restriction
   * @param queryEmbedding the query vector
   * @param topK maximum number of chunks
   * @param minSimilarity raw cosine similarity floor
   * @return chunks ordered by similarity, each carrying its similarity
   */
  public List<SourceChunk> searchCorpus(
      SourceType sourceType,
      String tenantId,
      Collection<String> sourceIds,
      List<Float> queryEmbedding,
      int topK,
      double minSimilarity) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(SOURCE_TYPE, sourceType);
    criteria.put(TENANT_ID, tenantId);
    if (sourceIds != null && !sourceIds.isEmpty()) {
      criteria.put(SOURCE_IDS, sourceIds);
    }
    return similaritySearch(criteria, queryEmbedding, topK, minSimilarity);
  }

  /** Deletes every chunk a tenant holds for one source, e.g. all chunks of a document. */
  public long deleteBySource(String tenantId, SourceType sourceType, String sourceId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(TENANT_ID, tenantId);
    criteria.put(SOURCE_TYPE, sourceType);
    criteria.put(SOURCE_ID, sourceId);
    return deleteBy(criteria);
  }

  /** Deletes every chunk a tenant holds in one collection, e.g. a synced table. */
  public long deleteByCollection(String tenantId, SourceType sourceType, String collection) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(TENANT_ID, tenantId);
    criteria.put(SOURCE_TYPE, sourceType);
    criteria.put(COLLECTION, collection);
    return deleteBy(criteria);
  }
}
