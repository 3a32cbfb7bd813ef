package com.flamingo.ai.knowledgehub.api.rest;

import com.flamingo.ai.knowledgehub.api.dto.request.IndexChunksRequest;
import com.flamingo.ai.knowledgehub.api.dto.response.IndexChunksResponse;
import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.service.ingest.ChunkIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller that accepts extracted chunks of documents and meetings. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class IngestionController {

  private final ChunkIngestionService chunkIngestionService;

  /** Replaces the indexed chunks of a document. */
  @PutMapping("/documents/{documentId}/chunks")
  public ResponseEntity<IndexChunksResponse> indexDocument(
      @PathVariable String documentId, @Valid @RequestBody IndexChunksRequest request) {
    int indexed =
        chunkIngestionService.indexDocumentChunks(
            request.toDescriptor(documentId), request.toInputs());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new IndexChunksResponse(documentId, indexed));
  }

  /** Replaces the indexed transcript chunks of a meeting. */
  @PutMapping("/meetings/{meetingId}/chunks")
  public ResponseEntity<IndexChunksResponse> indexMeeting(
      @PathVariable String meetingId, @Valid @RequestBody IndexChunksRequest request) {
    int indexed =
        chunkIngestionService.indexMeetingChunks(
            request.toDescriptor(meetingId), request.toInputs());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new IndexChunksResponse(meetingId, indexed));
  }

  /** Removes the tenant's indexed chunks of a document. */
  @DeleteMapping("/documents/{documentId}/chunks")
  public ResponseEntity<Void> deleteDocument(
      @PathVariable String documentId, @RequestParam String tenantId) {
    chunkIngestionService.deleteSource(tenantId, SourceType.DOCUMENT, documentId);
    return ResponseEntity.noContent().build();
  }

  /** Removes the tenant's indexed chunks of a meeting. */
  @DeleteMapping("/meetings/{meetingId}/chunks")
  public ResponseEntity<Void> deleteMeeting(
      @PathVariable String meetingId, @RequestParam String tenantId) {
    chunkIngestionService.deleteSource(tenantId, SourceType.MEETING, meetingId);
    return ResponseEntity.noContent().build();
  }
}
