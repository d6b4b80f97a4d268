package com.flamingo.ai.messagesearch.service.search;

/**
 * A message matching a query.
 *
 * @param similarity cosine similarity between query and message, in {@code [0, 1]}
 */
public record SearchResult(
    Long messageId,
    Long threadId,
    String sender,
    Long timestamp,
    String snippet,
    float similarity) {

  /** Similarity as a whole percentage, rounded down. */
  public int relevancePercent() {
    return (int) (similarity * 100);
  }
}
