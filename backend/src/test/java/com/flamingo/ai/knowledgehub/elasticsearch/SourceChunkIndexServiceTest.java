package com.flamingo.ai.knowledgehub.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SourceChunkIndexService Tests")
class SourceChunkIndexServiceTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private ElasticsearchClient elasticsearchClient;

  private SourceChunkIndexService indexService;

  @BeforeEach
  void setUp() {
    indexService =
        new SourceChunkIndexService(
            elasticsearchClient, new SimpleMeterRegistry(), "test-chunks", 3);
  }

  @Test
  @DisplayName("Should scope the kNN query by tenant, corpus and allowed sources")
  @SuppressWarnings({"unchecked", "rawtypes"})
  void shouldBuildScopedKnnQuery() throws Exception {
    SearchResponse<Map> response = emptyResponse();
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class))).thenReturn(response);

    indexService.searchCorpus(
        SourceType.DOCUMENT, "tenant-1", List.of("doc-1", "doc-2"), VECTOR, 5, 0.7);

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    SearchRequest request = captor.getValue();
    assertThat(request.index()).containsExactly("test-chunks");

    KnnSearch knn = request.knn().get(0);
    assertThat(knn.field()).isEqualTo("embedding");
    assertThat(knn.k()).isEqualTo(5);
    assertThat(knn.numCandidates()).isEqualTo(20);
    assertThat(knn.similarity()).isCloseTo(0.7f, within(1e-6f));

    List<Query> filters = knn.filter().get(0).bool().filter();
    assertThat(filters).hasSize(3);
    assertThat(filters)
        .filteredOn(Query::isTerm)
        .extracting(q -> q.term().field() + "=" + q.term().value().stringValue())
        .containsExactlyInAnyOrder("tenantId=tenant-1", "sourceType=document");
    assertThat(filters).filteredOn(Query::isTerms).hasSize(1);
  }

  @Test
  @DisplayName("Should convert cosine scores back to similarity and map hits to chunks")
  @SuppressWarnings({"unchecked", "rawtypes"})
  void shouldMapHits() throws Exception {
    Map<String, Object> source = new HashMap<>();
    source.put("tenantId", "tenant-1");
    source.put("sourceType", "tabular");
    source.put("sourceId", "rec1");
    source.put("sourceName", "Deals Record");
    source.put("collection", "Deals");
    source.put("content", "Table: Deals");
    source.put("chunkIndex", 0);
    source.put("fieldKey", "Deal Name");
    source.put("lastUpdated", "2024-05-01T10:00:00Z");
    Hit<Map> hit = mock(Hit.class);
    when(hit.source()).thenReturn(source);
    when(hit.id()).thenReturn("appBase_tbl_rec1");
    when(hit.score()).thenReturn(0.95);
    SearchResponse<Map> response = responseWith(List.of(hit));
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class))).thenReturn(response);

    List<SourceChunk> chunks =
        indexService.searchCorpus(SourceType.TABULAR, "tenant-1", null, VECTOR, 5, 0.7);

    assertThat(chunks).hasSize(1);
    SourceChunk chunk = chunks.get(0);
    assertThat(chunk.getId()).isEqualTo("appBase_tbl_rec1");
    assertThat(chunk.getSourceType()).isEqualTo(SourceType.TABULAR);
    assertThat(chunk.getFieldKey()).isEqualTo("Deal Name");
    assertThat(chunk.getLastUpdated()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    assertThat(chunk.getSimilarity()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  @DisplayName("Should refuse a search without a tenant")
  void shouldRequireTenant() {
    assertThatThrownBy(
            () -> indexService.searchCorpus(SourceType.DOCUMENT, null, null, VECTOR, 5, 0.7))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should refuse an unscoped delete")
  void shouldRequireDeleteScope() {
    assertThatThrownBy(() -> indexService.deleteBy(Map.of("sourceType", SourceType.DOCUMENT)))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should refuse a delete without a tenant")
  void shouldRequireDeleteTenant() {
    assertThatThrownBy(
            () ->
                indexService.deleteBy(
                    Map.of("sourceType", SourceType.DOCUMENT, "sourceId", "doc-1")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tenantId");
    assertThatThrownBy(() -> indexService.deleteBySource(null, SourceType.DOCUMENT, "doc-1"))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should delete a source only within the requesting tenant")
  void shouldScopeSourceDeleteByTenant() throws Exception {
    DeleteByQueryResponse response = mock(DeleteByQueryResponse.class);
    when(response.deleted()).thenReturn(3L);
    when(elasticsearchClient.deleteByQuery(any(DeleteByQueryRequest.class))).thenReturn(response);

    long deleted = indexService.deleteBySource("tenant-2", SourceType.DOCUMENT, "doc-1");

    assertThat(deleted).isEqualTo(3L);
    ArgumentCaptor<DeleteByQueryRequest> captor =
        ArgumentCaptor.forClass(DeleteByQueryRequest.class);
    verify(elasticsearchClient).deleteByQuery(captor.capture());
    assertThat(captor.getValue().query().bool().filter())
        .extracting(q -> q.term().field() + "=" + q.term().value().stringValue())
        .containsExactlyInAnyOrder("tenantId=tenant-2", "sourceType=document", "sourceId=doc-1");
  }

  @Test
  @DisplayName("Should delete a table's chunks only within the requesting tenant")
  void shouldScopeCollectionDeleteByTenant() throws Exception {
    DeleteByQueryResponse response = mock(DeleteByQueryResponse.class);
    when(elasticsearchClient.deleteByQuery(any(DeleteByQueryRequest.class))).thenReturn(response);

    indexService.deleteByCollection("tenant-1", SourceType.TABULAR, "Deals");

    ArgumentCaptor<DeleteByQueryRequest> captor =
        ArgumentCaptor.forClass(DeleteByQueryRequest.class);
    verify(elasticsearchClient).deleteByQuery(captor.capture());
    assertThat(captor.getValue().query().bool().filter())
        .extracting(q -> q.term().field() + "=" + q.term().value().stringValue())
        .containsExactlyInAnyOrder("tenantId=tenant-1", "sourceType=tabular", "collection=Deals");
  }

  @Test
  @DisplayName("Should keep num_candidates within the Elasticsearch limit")
  @SuppressWarnings({"unchecked", "rawtypes"})
  void shouldCapNumCandidates() throws Exception {
    SearchResponse<Map> response = emptyResponse();
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class))).thenReturn(response);

    indexService.searchCorpus(SourceType.MEETING, "tenant-1", null, VECTOR, 3000, 0.7);

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    assertThat(captor.getValue().knn().get(0).numCandidates())
        .isEqualTo(SourceChunkIndexService.MAX_NUM_CANDIDATES);
  }

  @Test
  @DisplayName("Should write only the fields a chunk carries")
  void shouldConvertToDocument() {
    SourceChunk chunk =
        SourceChunk.builder()
            .id("doc-1_0")
            .sourceType(SourceType.DOCUMENT)
            .tenantId("tenant-1")
            .sourceId("doc-1")
            .sourceName("Q3 Report.pdf")
            .content("Revenue grew")
            .embedding(VECTOR)
            .pageNumber(2)
            .build();

    Map<String, Object> document = indexService.convertToDocument(chunk);

    assertThat(document)
        .containsEntry("sourceType", "document")
        .containsEntry("pageNumber", 2)
        .containsEntry("embedding", VECTOR)
        .doesNotContainKeys("timestamp", "fieldKey", "editUrl", "collection");
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static SearchResponse<Map> emptyResponse() {
    return responseWith(List.of());
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static SearchResponse<Map> responseWith(List<Hit<Map>> hits) {
    HitsMetadata<Map> metadata = mock(HitsMetadata.class);
    when(metadata.hits()).thenReturn(hits);
    SearchResponse<Map> response = mock(SearchResponse.class);
    when(response.hits()).thenReturn(metadata);
    return response;
  }
}
