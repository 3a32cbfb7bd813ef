package com.flamingo.ai.knowledgehub.service.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a webhook trigger.
 *
 * @param success whether an attempt succeeded
 * @param executionId execution id reported by the automation host, if any
 * @param error message of the last failure when unsuccessful
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookTriggerResponse(boolean success, String executionId, String error) {

  public static WebhookTriggerResponse succeeded(String executionId) {
    return new WebhookTriggerResponse(true, executionId, null);
  }

  public static WebhookTriggerResponse failed(String error) {
    return new WebhookTriggerResponse(false, null, error);
  }
}
