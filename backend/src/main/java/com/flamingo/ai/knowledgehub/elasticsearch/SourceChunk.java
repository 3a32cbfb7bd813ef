package com.flamingo.ai.knowledgehub.elasticsearch;

import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The unit of retrieval: a piece of text from one corpus together with its embedding.
 *
 * <p>Document and meeting chunks are identified by {@code tenantId_sourceId_chunkIndex}; tabular
 * chunks by {@code tenantId_baseId_tableId_externalId}. Ids are deterministic so re-indexing a
 * source overwrites its own chunks and never those of another tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private SourceType sourceType;
  private String tenantId;
  private String sourceId;
  private String sourceName;

  /** Grouping inside a source type; the table name for tabular records. */
  private String collection;

  private String content;
  private List<Float> embedding;

  @Builder.Default private int chunkIndex = 0;

  /** Page of the document the chunk starts on, when the extractor reported one. */
  private Integer pageNumber;

  /** Position in the meeting, e.g. {@code 00:12:45}. */
  private String timestamp;

  /** Field of the tabular record used as its label. */
  private String fieldKey;

  /** Link to edit the record at its source. */
  private String editUrl;

  private Instant lastUpdated;

  /** Cosine similarity to the query, set by similarity search. */
  private Double similarity;

  /** Builds the deterministic id of a document or meeting chunk. */
  public static String chunkId(String tenantId, String sourceId, int chunkIndex) {
    return tenantId + "_" + sourceId + "_" + chunkIndex;
  }
}
