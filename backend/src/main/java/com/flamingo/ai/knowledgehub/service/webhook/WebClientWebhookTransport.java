package com.flamingo.ai.knowledgehub.service.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledgehub.config.WebhookConfig;
import com.flamingo.ai.knowledgehub.exception.WebhookDeliveryException;
import com.flamingo.ai.knowledgehub.service.webhook.event.WebhookPayload;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

/** {@link WebhookTransport} over Spring's reactive {@link WebClient}, blocking per attempt. */
@Component
@Slf4j
public class WebClientWebhookTransport implements WebhookTransport {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final Duration timeout;

  public WebClientWebhookTransport(
      @Qualifier("webhookWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      WebhookConfig webhookConfig) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.apiKey = webhookConfig.getApiKey();
    this.timeout = Duration.ofMillis(webhookConfig.getTimeoutMs());
  }

  @Override
  public Map<String, Object> post(String url, WebhookPayload payload) {
    String body;
    try {
      body =
          webClient
              .post()
              .uri(url)
              .contentType(MediaType.APPLICATION_JSON)
              .headers(
                  headers -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                      headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                    }
                  })
              .bodyValue(payload)
              .retrieve()
              .onStatus(
                  HttpStatusCode::isError,
                  response ->
                      response
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              text ->
                                  new WebhookDeliveryException(
                                      response.statusCode().value(), text)))
              .bodyToMono(String.class)
              .timeout(timeout)
              .block();
    } catch (WebhookDeliveryException e) {
      throw e;
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof WebhookDeliveryException delivery) {
        throw delivery;
      }
      if (cause instanceof TimeoutException) {
        throw new WebhookDeliveryException(
            "Webhook request timed out after " + timeout.toMillis() + " ms", cause);
      }
      throw new WebhookDeliveryException("Webhook request failed: " + cause.getMessage(), cause);
    }
    return parse(body);
  }

  private Map<String, Object> parse(String body) {
    if (body == null || body.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      return objectMapper.readValue(body, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.debug("Webhook response is not a JSON object, keeping it as text");
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("body", body);
      return raw;
    }
  }
}
