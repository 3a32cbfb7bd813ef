package com.flamingo.ai.knowledgehub.service.ingest;

import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunkIndexService;
import com.flamingo.ai.knowledgehub.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgehub.service.webhook.WebhookDispatcher;
import com.flamingo.ai.knowledgehub.service.webhook.event.DocumentUploadedEvent;
import com.flamingo.ai.knowledgehub.service.webhook.event.MeetingSyncedEvent;
import com.flamingo.ai.knowledgehub.service.webhook.event.OutboundEvent;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds and indexes chunks handed over by the text extractor.
 *
 * <p>Chunk ids are {@code tenantId_sourceId_chunkIndex}. The tenant's previous chunks of a source
 * are removed before its new ones are indexed; other tenants' chunks are never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkIngestionService {

  private final EmbeddingService embeddingService;
  private final SourceChunkIndexService sourceChunkIndexService;
  private final WebhookDispatcher webhookDispatcher;
  private final MeterRegistry meterRegistry;

  /** Indexes the chunks of a document and announces it as {@code new_document}. */
  @Timed(value = "ingest.document", description = "Time to index document chunks")
  public int indexDocumentChunks(SourceDescriptor source, List<ChunkInput> chunks) {
    int indexed = index(SourceType.DOCUMENT, source, chunks);
    publish(
        new DocumentUploadedEvent(
            source.tenantId(),
            Instant.now(),
            source.sourceId(),
            source.sourceName(),
            source.mediaType(),
            source.pageCount()));
    return indexed;
  }

  /** Indexes the transcript chunks of a meeting and announces it as {@code meeting_synced}. */
  @Timed(value = "ingest.meeting", description = "Time to index meeting chunks")
  public int indexMeetingChunks(SourceDescriptor source, List<ChunkInput> chunks) {
    int indexed = index(SourceType.MEETING, source, chunks);
    publish(
        new MeetingSyncedEvent(
            source.tenantId(),
            Instant.now(),
            source.sourceId(),
            source.externalId(),
            source.sourceName(),
            source.participants(),
            source.durationMinutes()));
    return indexed;
  }

  /** Removes every chunk a tenant holds for a source from the index. */
  public long deleteSource(String tenantId, SourceType sourceType, String sourceId) {
    if (sourceType == SourceType.TABULAR) {
      throw new IllegalArgumentException("Tabular records are removed through the sync engine");
    }
    if (isBlank(tenantId) || isBlank(sourceId)) {
      throw new IllegalArgumentException("tenantId and sourceId are required");
    }
    long deleted = sourceChunkIndexService.deleteBySource(tenantId, sourceType, sourceId);
    log.info(
        "Deleted {} chunk(s) of {} {} for tenant {}",
        deleted,
        sourceType.getValue(),
        sourceId,
        tenantId);
    return deleted;
  }

  private int index(SourceType sourceType, SourceDescriptor source, List<ChunkInput> chunks) {
    validate(source, chunks);
    List<String> texts = chunks.stream().map(ChunkInput::content).toList();
    List<List<Float>> embeddings = embeddingService.embedBatch(texts);

    Instant now = Instant.now();
    List<SourceChunk> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      ChunkInput input = chunks.get(i);
      documents.add(
          SourceChunk.builder()
              .id(SourceChunk.chunkId(source.tenantId(), source.sourceId(), i))
              .sourceType(sourceType)
              .tenantId(source.tenantId())
              .sourceId(source.sourceId())
              .sourceName(source.sourceName())
              .content(input.content())
              .embedding(embeddings.get(i))
              .chunkIndex(i)
              .pageNumber(input.pageNumber())
              .timestamp(input.timestamp())
              .lastUpdated(now)
              .build());
    }

    sourceChunkIndexService.deleteBySource(
        source.tenantId(), sourceType, source.sourceId());
    sourceChunkIndexService.indexChunks(documents);
    meterRegistry
        .counter("ingest.chunks", "source_type", sourceType.getValue())
        .increment(documents.size());
    log.info(
        "Indexed {} chunk(s) of {} {} for tenant {}",
        documents.size(),
        sourceType.getValue(),
        source.sourceId(),
        source.tenantId());
    return documents.size();
  }

  private void publish(OutboundEvent event) {
    try {
      webhookDispatcher.triggerAsync(event);
    } catch (RuntimeException e) {
      log.warn("Could not publish {} event: {}", event.type(), e.getMessage());
    }
  }

  private static void validate(SourceDescriptor source, List<ChunkInput> chunks) {
    if (source == null
        || isBlank(source.tenantId())
        || isBlank(source.sourceId())
        || isBlank(source.sourceName())) {
      throw new IllegalArgumentException("tenantId, sourceId and sourceName are required");
    }
    if (chunks == null || chunks.isEmpty()) {
      throw new IllegalArgumentException("at least one chunk is required");
    }
    for (ChunkInput chunk : chunks) {
      if (chunk == null || isBlank(chunk.content())) {
        throw new IllegalArgumentException("chunk content must not be blank");
      }
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
