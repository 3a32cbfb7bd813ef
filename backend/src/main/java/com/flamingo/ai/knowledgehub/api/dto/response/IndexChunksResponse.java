package com.flamingo.ai.knowledgehub.api.dto.response;

/** Response DTO for an indexing request. */
public record IndexChunksResponse(String sourceId, int chunksIndexed) {}
