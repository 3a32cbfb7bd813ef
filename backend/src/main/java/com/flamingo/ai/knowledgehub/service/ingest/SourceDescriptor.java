package com.flamingo.ai.knowledgehub.service.ingest;

import java.util.List;
import lombok.Builder;

/**
 * Identity and metadata of a document or meeting being indexed.
 *
 * @param tenantId owning tenant
 * @param sourceId document or meeting id
 * @param sourceName display name used in the context and citations
 * @param mediaType document type such as {@code pdf}; documents only
 * @param pageCount number of pages; documents only
 * @param externalId id of the meeting at the recording provider; meetings only
 * @param participants meeting participants; meetings only
 * @param durationMinutes meeting length; meetings only
 */
@Builder
public record SourceDescriptor(
    String tenantId,
    String sourceId,
    String sourceName,
    String mediaType,
    Integer pageCount,
    String externalId,
    List<String> participants,
    Integer durationMinutes) {}
