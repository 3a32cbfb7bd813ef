package com.flamingo.ai.knowledgehub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for outbound automation webhooks.
 *
 * <p>Read once by the dispatcher at construction.
 */
@Configuration
@ConfigurationProperties(prefix = "webhook")
@Getter
@Setter
public class WebhookConfig {

  /** Base URL of the automation host, e.g. {@code https://n8n.example.com}. */
  private String baseUrl;

  /** Optional bearer token sent with every delivery. */
  private String apiKey;

  private long timeoutMs = 30000;
  private int maxRetries = 3;

  /**
   * Unit of the exponential backoff. The wait after failed attempt {@code i} is {@code 2^i}
   * units.
   */
  private long backoffUnitMs = 1000;
}
