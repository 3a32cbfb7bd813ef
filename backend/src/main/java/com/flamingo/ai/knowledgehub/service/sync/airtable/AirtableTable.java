package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Table of the base schema. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirtableTable(
    String id, String name, String primaryFieldId, List<AirtableField> fields) {

  /** Name of the primary field, used as the record label; null when unknown. */
  public String primaryFieldName() {
    if (primaryFieldId == null || fields == null) {
      return null;
    }
    return fields.stream()
        .filter(field -> primaryFieldId.equals(field.id()))
        .map(AirtableField::name)
        .findFirst()
        .orElse(null);
  }

  /** Whether this table is selected by a name-or-id filter. */
  public boolean matches(List<String> selectors) {
    return selectors.contains(name) || selectors.contains(id);
  }
}
