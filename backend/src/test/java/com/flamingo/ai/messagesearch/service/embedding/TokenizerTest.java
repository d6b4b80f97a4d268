package com.flamingo.ai.messagesearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

  private Tokenizer tokenizer;

  @BeforeEach
  void setUp() {
    tokenizer = new Tokenizer(new SemanticSearchConfig());
  }

  @Test
  @DisplayName("Should lowercase and split on punctuation and whitespace")
  void shouldLowercaseAndSplit() {
    assertThat(tokenizer.tokenize("MEETING moved to Tomorrow, room-B12!"))
        .containsExactly("meeting", "moved", "tomorrow", "room", "b12");
  }

  @Test
  @DisplayName("Should drop stop words and short tokens while keeping order")
  void shouldDropStopWordsAndShortTokens() {
    assertThat(tokenizer.tokenize("What is the gate code for the house"))
        .containsExactly("gate", "code", "house");
  }

  @Test
  @DisplayName("Should keep numeric tokens of sufficient length")
  void shouldKeepNumericTokens() {
    assertThat(tokenizer.tokenize("gate code is 4521 not 42"))
        .containsExactly("gate", "code", "4521");
  }

  @Test
  @DisplayName("Should treat non-ASCII letters as separators")
  void shouldTreatNonAsciiAsSeparator() {
    assertThat(tokenizer.tokenize("naïve résumé")).containsExactly("sum");
  }

  @Test
  @DisplayName("Should keep repeated tokens")
  void shouldKeepRepeatedTokens() {
    assertThat(tokenizer.tokenize("pizza pizza PIZZA")).containsExactly("pizza", "pizza", "pizza");
  }

  @Test
  @DisplayName("Should return empty list for null, empty and stop-word-only text")
  void shouldReturnEmptyForTrivialInput() {
    assertThat(tokenizer.tokenize(null)).isEmpty();
    assertThat(tokenizer.tokenize("")).isEmpty();
    assertThat(tokenizer.tokenize("the and you would have")).isEmpty();
    assertThat(tokenizer.tokenize("?! ... --")).isEmpty();
  }

  @Test
  @DisplayName("Should honour a configured minimum token length")
  void shouldHonourConfiguredMinimumLength() {
    SemanticSearchConfig config = new SemanticSearchConfig();
    config.getEmbedding().setMinTokenLength(5);
    Tokenizer strict = new Tokenizer(config);

    assertThat(strict.tokenize("roof repair budget")).containsExactly("repair", "budget");
    assertThat(strict.getMinTokenLength()).isEqualTo(5);
  }

  @Test
  @DisplayName("Stop word list should hold the hundred most common English words")
  void stopWordListShouldBeComplete() {
    assertThat(Tokenizer.STOP_WORDS).hasSize(100).contains("the", "because", "people", "us");
  }
}
