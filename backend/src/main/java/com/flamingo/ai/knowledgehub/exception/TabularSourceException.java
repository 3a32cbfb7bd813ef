package com.flamingo.ai.knowledgehub.exception;

/** Exception thrown when the tabular source API rejects or fails a request. */
public class TabularSourceException extends RuntimeException {

  private final int statusCode;

  public TabularSourceException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public TabularSourceException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  /** HTTP status returned by the source, or 0 when the call never got a response. */
  public int getStatusCode() {
    return statusCode;
  }

  public String getUserMessage() {
    return "The external data source could not be reached. Please try again later.";
  }
}
