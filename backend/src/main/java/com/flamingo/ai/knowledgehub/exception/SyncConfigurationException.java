package com.flamingo.ai.knowledgehub.exception;

/**
 * Exception thrown before any sync work starts when credentials, the base id or the tenant are
 * missing. Not retryable.
 */
public class SyncConfigurationException extends RuntimeException {

  private final String userMessage;

  public SyncConfigurationException(String message) {
    super(message);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
