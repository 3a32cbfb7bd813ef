package com.flamingo.ai.knowledgehub.service.sync;

import java.util.List;

/** Outcome of re-embedding a table: records re-indexed and one message per failed record. */
public record ReembedResult(int updated, List<String> errors) {}
