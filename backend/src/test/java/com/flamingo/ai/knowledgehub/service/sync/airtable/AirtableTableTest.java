package com.flamingo.ai.knowledgehub.service.sync.airtable;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Airtable model Tests")
class AirtableTableTest {

  private final AirtableTable deals =
      new AirtableTable(
          "tblDeals",
          "Deals",
          "fld2",
          List.of(
              new AirtableField("fld1", "Amount", "currency"),
              new AirtableField("fld2", "Deal Name", "singleLineText")));

  @Test
  @DisplayName("Should resolve the primary field name by id")
  void shouldResolvePrimaryField() {
    assertThat(deals.primaryFieldName()).isEqualTo("Deal Name");
    assertThat(new AirtableTable("t", "T", null, List.of()).primaryFieldName()).isNull();
  }

  @Test
  @DisplayName("Should match a selector by name or id")
  void shouldMatchByNameOrId() {
    assertThat(deals.matches(List.of("Deals"))).isTrue();
    assertThat(deals.matches(List.of("tblDeals"))).isTrue();
    assertThat(deals.matches(List.of("deals"))).isFalse();
  }

  @Test
  @DisplayName("Should parse the record creation time")
  void shouldParseCreatedTime() {
    assertThat(new AirtableRecord("rec1", "2024-03-05T08:30:00.000Z", Map.of()).createdAt())
        .isEqualTo(Instant.parse("2024-03-05T08:30:00Z"));
    assertThat(new AirtableRecord("rec1", null, Map.of()).createdAt()).isNull();
  }

  @Test
  @DisplayName("Should treat a blank offset as the last page")
  void shouldDetectLastPage() {
    assertThat(new AirtableRecordPage(List.of(), "itr1").hasMore()).isTrue();
    assertThat(new AirtableRecordPage(List.of(), "").hasMore()).isFalse();
    assertThat(new AirtableRecordPage(List.of(), null).hasMore()).isFalse();
  }
}
