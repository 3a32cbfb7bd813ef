package com.flamingo.ai.knowledgehub.service.ingest;

/**
 * One already-extracted chunk of a document or meeting transcript.
 *
 * @param content chunk text, non-blank
 * @param pageNumber page the chunk starts on, documents only
 * @param timestamp position in the recording, meetings only
 */
public record ChunkInput(String content, Integer pageNumber, String timestamp) {

  public static ChunkInput ofPage(String content, Integer pageNumber) {
    return new ChunkInput(content, pageNumber, null);
  }

  public static ChunkInput ofTimestamp(String content, String timestamp) {
    return new ChunkInput(content, null, timestamp);
  }
}
