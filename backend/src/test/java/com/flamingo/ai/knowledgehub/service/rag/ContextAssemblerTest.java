package com.flamingo.ai.knowledgehub.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgehub.domain.enums.SourceType;
import com.flamingo.ai.knowledgehub.elasticsearch.SourceChunk;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContextAssembler Tests")
class ContextAssemblerTest {

  private final ContextAssembler assembler = new ContextAssembler();

  @Test
  @DisplayName("Should format entries with source name and blank line separator")
  void shouldFormatEntries() {
    RetrievalResult result =
        assembler.assemble(List.of(chunk("Q3 Report", "abcd"), chunk("Deals", "efgh")), 1000);

    assertThat(result.context()).isEqualTo("[Q3 Report]: abcd\n\n[Deals]: efgh");
    assertThat(result.chunks()).hasSize(2);
  }

  @Test
  @DisplayName("Should estimate tokens as characters over four rounded up")
  void shouldEstimateTokens() {
    RetrievalResult result = assembler.assemble(List.of(chunk("A", "x")), 1000);

    // "[A]: x" is 6 characters
    assertThat(result.estimatedTokens()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should stop before the entry that would exceed the budget")
  void shouldRespectBudget() {
    // each entry "[A]: " + 11 chars = 16 chars, separator 2 chars
    List<SourceChunk> ranked =
        List.of(chunk("A", "first chunk"), chunk("A", "second chun"), chunk("A", "third chunk"));

    RetrievalResult result = assembler.assemble(ranked, 8);

    assertThat(result.chunks()).hasSize(1);
    assertThat(result.context()).isEqualTo("[A]: first chunk");
    assertThat(result.estimatedTokens()).isLessThanOrEqualTo(8);
  }

  @Test
  @DisplayName("Should include the best chunk even when it alone exceeds the budget")
  void shouldAlwaysIncludeBestChunk() {
    RetrievalResult result = assembler.assemble(List.of(chunk("A", "z".repeat(100))), 1);

    assertThat(result.chunks()).hasSize(1);
    assertThat(result.estimatedTokens()).isEqualTo(27);
  }

  @Test
  @DisplayName("Should return an empty result for no chunks")
  void shouldHandleNoChunks() {
    assertThat(assembler.assemble(List.of(), 100).isEmpty()).isTrue();
  }

  private static SourceChunk chunk(String name, String content) {
    return SourceChunk.builder()
        .id(name + content)
        .sourceType(SourceType.DOCUMENT)
        .sourceName(name)
        .content(content)
        .build();
  }
}
