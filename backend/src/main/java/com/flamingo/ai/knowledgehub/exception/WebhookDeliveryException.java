package com.flamingo.ai.knowledgehub.exception;

/** Exception raised for a single failed webhook attempt; never escapes the dispatcher. */
public class WebhookDeliveryException extends RuntimeException {

  private final int statusCode;

  public WebhookDeliveryException(int statusCode, String responseBody) {
    super("Webhook endpoint returned " + statusCode + ": " + responseBody);
    this.statusCode = statusCode;
  }

  public WebhookDeliveryException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
