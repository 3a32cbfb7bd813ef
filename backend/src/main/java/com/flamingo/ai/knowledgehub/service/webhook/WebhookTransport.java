package com.flamingo.ai.knowledgehub.service.webhook;

import com.flamingo.ai.knowledgehub.exception.WebhookDeliveryException;
import com.flamingo.ai.knowledgehub.service.webhook.event.WebhookPayload;
import java.util.Map;

/** One delivery attempt of a payload to an automation endpoint. */
public interface WebhookTransport {

  /**
   * Posts the payload and waits for the response.
   *
   * @param url full endpoint URL
   * @param payload the JSON body
   * @return the parsed response body, empty when the endpoint returned none
   * @throws WebhookDeliveryException on a non-2xx status, a timeout or a connection failure
   */
  Map<String, Object> post(String url, WebhookPayload payload);
}
