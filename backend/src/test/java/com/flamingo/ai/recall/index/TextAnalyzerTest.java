package com.flamingo.ai.recall.index;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextAnalyzerTest {

  private final TextAnalyzer analyzer = new TextAnalyzer();

  @AfterEach
  void tearDown() {
    analyzer.close();
  }

  @Test
  @DisplayName("should fold accents and case and drop stop words")
  void shouldFoldAccentsAndDropStopWords() {
    assertThat(analyzer.analyze("Les Éléphants mangent des pommes!"))
        .containsExactly("elephant", "mangent", "pomme");
  }

  @Test
  @DisplayName("should drop single characters but keep numbers")
  void shouldDropSingleCharacters() {
    assertThat(analyzer.analyze("a I x 42")).containsExactly("42");
  }

  @Test
  @DisplayName("should strip plural endings but leave words ending in -us or -ss")
  void shouldStripPluralEndings() {
    assertThat(analyzer.analyze("cats bus indexes queries glass"))
        .containsExactly("cat", "bus", "indexe", "query", "glass");
  }

  @Test
  @DisplayName("should split hyphenated words and punctuation")
  void shouldSplitOnPunctuation() {
    assertThat(analyzer.analyze("write-ahead logging: enabled?"))
        .containsExactly("write", "ahead", "logging", "enabled");
  }

  @Test
  @DisplayName("should keep duplicates in order of occurrence")
  void shouldKeepDuplicates() {
    assertThat(analyzer.analyze("sqlite SQLite, sqlite"))
        .containsExactly("sqlite", "sqlite", "sqlite");
  }

  @Test
  @DisplayName("should return nothing for null or blank text")
  void shouldHandleBlank() {
    assertThat(analyzer.analyze(null)).isEmpty();
    assertThat(analyzer.analyze("   ")).isEmpty();
    assertThat(analyzer.analyze("the and of")).isEmpty();
  }
}
