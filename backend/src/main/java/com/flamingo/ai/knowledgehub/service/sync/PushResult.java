package com.flamingo.ai.knowledgehub.service.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.knowledgehub.service.sync.airtable.AirtableRecord;

/** Outcome of a push; carries the written record on success and the error otherwise. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushResult(boolean success, AirtableRecord record, String error) {

  static PushResult written(AirtableRecord record) {
    return new PushResult(true, record, null);
  }

  static PushResult failed(String error) {
    return new PushResult(false, null, error);
  }
}
