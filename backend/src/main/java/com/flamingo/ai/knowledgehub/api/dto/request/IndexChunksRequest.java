package com.flamingo.ai.knowledgehub.api.dto.request;

import com.flamingo.ai.knowledgehub.service.ingest.ChunkInput;
import com.flamingo.ai.knowledgehub.service.ingest.SourceDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying the extracted chunks of one document or meeting. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexChunksRequest {

  @NotBlank(message = "Tenant id is required")
  private String tenantId;

  @NotBlank(message = "Source name is required")
  private String sourceName;

  private String mediaType;
  private Integer pageCount;
  private String externalId;
  private List<String> participants;
  private Integer durationMinutes;

  @NotEmpty(message = "At least one chunk is required")
  @Valid
  private List<Chunk> chunks;

  /** One extracted chunk. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Chunk {
    @NotBlank(message = "Chunk content is required")
    private String content;

    private Integer pageNumber;
    private String timestamp;
  }

  public SourceDescriptor toDescriptor(String sourceId) {
    return SourceDescriptor.builder()
        .tenantId(tenantId)
        .sourceId(sourceId)
        .sourceName(sourceName)
        .mediaType(mediaType)
        .pageCount(pageCount)
        .externalId(externalId)
        .participants(participants)
        .durationMinutes(durationMinutes)
        .build();
  }

  public List<ChunkInput> toInputs() {
    return chunks.stream()
        .map(c -> new ChunkInput(c.getContent(), c.getPageNumber(), c.getTimestamp()))
        .toList();
  }
}
