package com.flamingo.ai.knowledgehub.exception;

/** Exception thrown when the embedding provider cannot produce a vector. */
public class EmbeddingException extends RuntimeException {

  private final String userMessage;

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
