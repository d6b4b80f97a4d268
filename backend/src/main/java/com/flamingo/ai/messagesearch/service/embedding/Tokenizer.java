package com.flamingo.ai.messagesearch.service.embedding;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw message text into the token sequence used for term statistics and embeddings.
 *
 * <p>Text is lowercased and split on every character outside {@code [a-z0-9]}. Tokens shorter than
 * the configured minimum length and common English stop words are dropped. Order is preserved.
 */
@Component
public class Tokenizer {

  // Common English stop words
  public static final Set<String> STOP_WORDS =
      Set.of(
          "the", "be", "to", "of", "and", "a", "in", "that", "have", "i", "it", "for", "not", "on",
          "with", "he", "as", "you", "do", "at", "this", "but", "his", "by", "from", "they", "we",
          "say", "her", "she", "or", "an", "will", "my", "one", "all", "would", "there", "their",
          "what", "so", "up", "out", "if", "about", "who", "get", "which", "go", "me", "when",
          "make", "can", "like", "time", "no", "just", "him", "know", "take", "people", "into",
          "year", "your", "good", "some", "could", "them", "see", "other", "than", "then", "now",
          "look", "only", "come", "its", "over", "think", "also", "back", "after", "use", "two",
          "how", "our", "work", "first", "well", "way", "even", "new", "want", "because", "any",
          "these", "give", "day", "most", "us");

  private static final Pattern DELIMITER = Pattern.compile("[^a-z0-9]+");

  private final int minTokenLength;

  public Tokenizer(SemanticSearchConfig config) {
    this.minTokenLength = config.getEmbedding().getMinTokenLength();
  }

  /**
   * Splits text into filtered, lowercased tokens.
   *
   * @param text raw text, may be null
   * @return tokens in input order; empty when nothing survives filtering
   */
  public List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : DELIMITER.split(text.toLowerCase(Locale.ROOT))) {
      if (token.length() >= minTokenLength && !STOP_WORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  public int getMinTokenLength() {
    return minTokenLength;
  }
}
