package com.flamingo.ai.knowledgehub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/** WebClient instances for the two outbound HTTP integrations. */
@Configuration
public class WebClientConfig {

  private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

  @Bean(name = "airtableWebClient")
  public WebClient airtableWebClient(AirtableConfig airtableConfig) {
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(airtableConfig.getApiUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    if (airtableConfig.getApiKey() != null && !airtableConfig.getApiKey().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + airtableConfig.getApiKey());
    }
    return builder.build();
  }

  /** Base URL is not set here; the dispatcher resolves full endpoint URLs per event type. */
  @Bean(name = "webhookWebClient")
  public WebClient webhookWebClient() {
    return WebClient.builder()
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
        .build();
  }
}
