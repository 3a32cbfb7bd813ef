package com.flamingo.ai.knowledgehub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the Airtable tabular source. */
@Configuration
@ConfigurationProperties(prefix = "airtable")
@Getter
@Setter
public class AirtableConfig {

  private String apiUrl = "https://api.airtable.com/v0";
  private String apiKey;
  private String baseId;

  /** Records requested per page; Airtable caps this at 100. */
  private int pageSize = 100;

  private int timeoutMs = 30000;

  /** Tenant assigned to synced records when a sync request does not name one. */
  private String defaultTenantId;

  /** Whether records are embedded during sync unless the caller says otherwise. */
  private boolean embedRecords = true;

  /** Returns true when both credentials needed to reach the base are present. */
  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank() && baseId != null && !baseId.isBlank();
  }
}
