package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.knowledgehub.config.AirtableConfig;
import com.flamingo.ai.knowledgehub.exception.TabularSourceException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/** Airtable REST client over {@link WebClient}. Calls block for at most the configured timeout. */
@Component
@Slf4j
public class AirtableClient implements TabularSourceClient {

  private static final String WEB_URL = "https://airtable.com";

  private final WebClient webClient;
  private final AirtableConfig airtableConfig;
  private final Duration timeout;

  public AirtableClient(
      @Qualifier("airtableWebClient") WebClient webClient, AirtableConfig airtableConfig) {
    this.webClient = webClient;
    this.airtableConfig = airtableConfig;
    this.timeout = Duration.ofMillis(airtableConfig.getTimeoutMs());
  }

  @Override
  public List<AirtableTable> listTables() {
    TablesResponse response =
        call(
            "list tables",
            () ->
                webClient
                    .get()
                    .uri("/meta/bases/{baseId}/tables", baseId())
                    .retrieve()
                    .bodyToMono(TablesResponse.class)
                    .timeout(timeout)
                    .block());
    return response == null || response.tables() == null ? List.of() : response.tables();
  }

  @Override
  public AirtableRecordPage listRecords(String tableId, int pageSize, String offset) {
    AirtableRecordPage page =
        call(
            "list records of " + tableId,
            () ->
                webClient
                    .get()
                    .uri(
                        uri -> {
                          uri.path("/{baseId}/{tableId}").queryParam("pageSize", pageSize);
                          if (offset != null) {
                            uri.queryParam("offset", offset);
                          }
                          return uri.build(baseId(), tableId);
                        })
                    .retrieve()
                    .bodyToMono(AirtableRecordPage.class)
                    .timeout(timeout)
                    .block());
    return page == null ? new AirtableRecordPage(List.of(), null) : page;
  }

  @Override
  public List<AirtableRecord> listAllRecords(String tableId) {
    List<AirtableRecord> records = new ArrayList<>();
    String offset = null;
    int pages = 0;
    do {
      AirtableRecordPage page = listRecords(tableId, airtableConfig.getPageSize(), offset);
      if (page.records() != null) {
        records.addAll(page.records());
      }
      offset = page.hasMore() ? page.offset() : null;
      pages++;
    } while (offset != null);
    log.debug("Fetched {} record(s) of table {} in {} page(s)", records.size(), tableId, pages);
    return records;
  }

  @Override
  public AirtableRecord createRecord(String table, Map<String, Object> fields) {
    return call(
        "create record in " + table,
        () ->
            webClient
                .post()
                .uri("/{baseId}/{table}", baseId(), table)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new WriteRequest(fields, true))
                .retrieve()
                .bodyToMono(AirtableRecord.class)
                .timeout(timeout)
                .block());
  }

  @Override
  public AirtableRecord updateRecord(String table, String recordId, Map<String, Object> fields) {
    return call(
        "update record " + recordId + " in " + table,
        () ->
            webClient
                .patch()
                .uri("/{baseId}/{table}/{recordId}", baseId(), table, recordId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new WriteRequest(fields, true))
                .retrieve()
                .bodyToMono(AirtableRecord.class)
                .timeout(timeout)
                .block());
  }

  @Override
  public String recordUrl(String tableId, String recordId) {
    return WEB_URL + "/" + baseId() + "/" + tableId + "/" + recordId;
  }

  private String baseId() {
    return airtableConfig.getBaseId();
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (WebClientResponseException e) {
      throw new TabularSourceException(
          "Airtable " + operation + " failed with " + e.getStatusCode().value() + ": "
              + e.getResponseBodyAsString(),
          e.getStatusCode().value());
    } catch (RuntimeException e) {
      Throwable cause = Exceptions.unwrap(e);
      throw new TabularSourceException(
          "Airtable " + operation + " failed: " + cause.getMessage(), cause);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TablesResponse(List<AirtableTable> tables) {}

  record WriteRequest(Map<String, Object> fields, boolean typecast) {}
}
