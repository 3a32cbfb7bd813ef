package com.flamingo.ai.knowledgehub.service.rag;

import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Formats ranked chunks into the context string for the generation model.
 *
 * <p>Each chunk becomes {@code "[sourceName]: content"}; entries are separated by a blank line.
 * Tokens are approximated as characters divided by four. Entries are added best first until the
 * next one would exceed the budget; the best chunk is always included.
 */
@Component
public class ContextAssembler {

  static final int CHARS_PER_TOKEN = 4;
  static final String SEPARATOR = "\n\n";

  public RetrievalResult assemble(List<SourceChunk> ranked, int maxContextTokens) {
    if (ranked.isEmpty()) {
      return RetrievalResult.empty();
    }
    long maxChars = (long) maxContextTokens * CHARS_PER_TOKEN;
    List<SourceChunk> included = new ArrayList<>();
    StringBuilder context = new StringBuilder();

    for (SourceChunk chunk : ranked) {
      String entry = formatEntry(chunk);
      int added = included.isEmpty() ? entry.length() : SEPARATOR.length() + entry.length();
      if (!included.isEmpty() && context.length() + added > maxChars) {
        break;
      }
      if (!included.isEmpty()) {
        context.append(SEPARATOR);
      }
      context.append(entry);
      included.add(chunk);
    }
    return new RetrievalResult(
        List.copyOf(included), context.toString(), estimateTokens(context.length()));
  }

  static String formatEntry(SourceChunk chunk) {
    return "[" + chunk.getSourceName() + "]: " + chunk.getContent();
  }

  static int estimateTokens(int chars) {
    return (int) Math.ceil(chars / (double) CHARS_PER_TOKEN);
  }
}
