package com.flamingo.ai.knowledgehub.service.webhook;

import com.flamingo.ai.knowledgehub.config.WebhookConfig;
import com.flamingo.ai.knowledgehub.domain.entity.WebhookLog;
import com.flamingo.ai.knowledgehub.domain.enums.WebhookDirection;
import com.flamingo.ai.knowledgehub.domain.enums.WebhookStatus;
import com.flamingo.ai.knowledgehub.domain.repository.WebhookLogRepository;
import com.flamingo.ai.knowledgehub.service.webhook.event.OutboundEvent;
import com.flamingo.ai.knowledgehub.service.webhook.event.OutboundEventType;
import com.flamingo.ai.knowledgehub.service.webhook.event.WebhookPayload;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Delivers outbound events to the automation host.
 *
 * <p>Each event is posted to the endpoint of its type with up to {@code webhook.max-retries}
 * sequential attempts. After failed attempt {@code i} the dispatcher waits {@code 2^i} backoff
 * units. Exactly one {@link WebhookLog} row is written per outcome. {@link #trigger} never
 * throws; failures are returned in the response.
 */
@Service
@Slf4j
public class WebhookDispatcher {

  static final String NOT_CONFIGURED = "webhook URL not configured";

  private final WebhookTransport transport;
  private final WebhookLogRepository webhookLogRepository;
  private final MeterRegistry meterRegistry;
  private final String baseUrl;
  private final int maxAttempts;
  private final IntervalFunction backoff;

  public WebhookDispatcher(
      WebhookTransport transport,
      WebhookLogRepository webhookLogRepository,
      MeterRegistry meterRegistry,
      WebhookConfig webhookConfig) {
    this.transport = transport;
    this.webhookLogRepository = webhookLogRepository;
    this.meterRegistry = meterRegistry;
    this.baseUrl = stripTrailingSlash(webhookConfig.getBaseUrl());
    this.maxAttempts = Math.max(1, webhookConfig.getMaxRetries());
    this.backoff = IntervalFunction.ofExponentialBackoff(2 * webhookConfig.getBackoffUnitMs(), 2.0);
    if (baseUrl == null) {
      log.warn("Webhook base URL not configured; outbound events will not be delivered");
    }
  }

  /**
   * Delivers an event, retrying with exponential backoff.
   *
   * @param event the event to deliver
   * @return success with the host's execution id, or failure with the last error
   */
  public WebhookTriggerResponse trigger(OutboundEvent event) {
    Objects.requireNonNull(event, "event");
    if (baseUrl == null) {
      return WebhookTriggerResponse.failed(NOT_CONFIGURED);
    }
    String url = baseUrl + OutboundEventType.pathFor(event.type());
    WebhookPayload payload = event.toPayload();
    AtomicInteger attempts = new AtomicInteger();

    Retry retry = Retry.of("webhook-" + event.type(), retryConfig());
    retry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "Webhook {} attempt {} failed, retrying in {} ms: {}",
                    event.type(),
                    e.getNumberOfRetryAttempts(),
                    e.getWaitInterval().toMillis(),
                    e.getLastThrowable().getMessage()));
    Supplier<Map<String, Object>> delivery =
        Retry.decorateSupplier(
            retry,
            () -> {
              attempts.incrementAndGet();
              meterRegistry.counter("webhook.attempts", "event_type", event.type()).increment();
              return transport.post(url, payload);
            });

    try {
      Map<String, Object> response = delivery.get();
      record(url, event, payload, response, WebhookStatus.SUCCESS, attempts.get());
      meterRegistry.counter("webhook.delivered", "event_type", event.type()).increment();
      log.info("Delivered {} webhook after {} attempt(s)", event.type(), attempts.get());
      Object executionId = response.get("executionId");
      return WebhookTriggerResponse.succeeded(executionId != null ? executionId.toString() : null);
    } catch (RuntimeException e) {
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      Map<String, Object> response = new LinkedHashMap<>();
      response.put("error", error);
      record(url, event, payload, response, WebhookStatus.ERROR, attempts.get());
      meterRegistry.counter("webhook.failed", "event_type", event.type()).increment();
      log.error(
          "Webhook {} failed after {} attempt(s): {}", event.type(), attempts.get(), error, e);
      return WebhookTriggerResponse.failed(error);
    }
  }

  /** Runs {@link #trigger} on the webhook executor for callers that do not wait. */
  @Async("webhookExecutor")
  public CompletableFuture<WebhookTriggerResponse> triggerAsync(OutboundEvent event) {
    return CompletableFuture.completedFuture(trigger(event));
  }

  /** Wait in milliseconds after failed attempt {@code attempt} (1-based). */
  @VisibleForTesting
  long backoffMillis(int attempt) {
    return backoff.apply(attempt);
  }

  private RetryConfig retryConfig() {
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(backoff)
        .retryExceptions(RuntimeException.class)
        .build();
  }

  private void record(
      String url,
      OutboundEvent event,
      WebhookPayload payload,
      Map<String, Object> response,
      WebhookStatus status,
      int attempts) {
    try {
      webhookLogRepository.save(
          WebhookLog.builder()
              .direction(WebhookDirection.OUTBOUND)
              .endpoint(url)
              .eventType(event.type())
              .payload(payload.toMap())
              .response(response)
              .status(status)
              .attempts(attempts)
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to write webhook log for {}: {}", event.type(), e.getMessage(), e);
    }
  }

  private static String stripTrailingSlash(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
