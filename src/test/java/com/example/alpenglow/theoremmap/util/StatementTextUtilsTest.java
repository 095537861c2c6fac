package com.example.alpenglow.theoremmap.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementTextUtilsTest {

  @Test
  void tokensAreLowercaseWordsWithoutDuplicates() {
    assertThat(StatementTextUtils.wordTokens("Safety holds; SAFETY is safe_ish."))
        .containsExactly("safety", "holds", "is", "safe_ish");
    assertThat(StatementTextUtils.wordTokens("  ")).isEmpty();
  }

  @Test
  void lineNumbersAreOneBased() {
    String text = "a\nb\nc";

    assertThat(StatementTextUtils.lineNumberAt(text, 0)).isEqualTo(1);
    assertThat(StatementTextUtils.lineNumberAt(text, text.indexOf('c'))).isEqualTo(3);
  }

  @Test
  void cleanProseStripsEmphasisAndWhitespace() {
    assertThat(StatementTextUtils.cleanProse("  **Bold**\n  and *it*   `code` ")).isEqualTo("Bold and it code");
  }
}
