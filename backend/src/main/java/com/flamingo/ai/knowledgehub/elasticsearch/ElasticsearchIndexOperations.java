package com.flamingo.ai.knowledgehub.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk. Documents are written under their own id, so indexing the
   * same document twice overwrites it.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs a vector similarity search with filters.
   *
   * @param filterCriteria key-value pairs for filtering (e.g., tenantId, sourceType)
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @param minSimilarity results below this raw similarity are not returned
   * @return matching documents ordered by similarity, each carrying its similarity
   */
  List<T> similaritySearch(
      Map<String, Object> filterCriteria,
      List<Float> queryEmbedding,
      int topK,
      double minSimilarity);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   * @return number of documents deleted
   */
  long deleteBy(Map<String, Object> criteria);

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
