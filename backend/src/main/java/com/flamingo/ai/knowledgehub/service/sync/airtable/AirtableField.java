package com.flamingo.ai.knowledgehub.service.sync.airtable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Column of a table in the base schema. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AirtableField(String id, String name, String type) {}
