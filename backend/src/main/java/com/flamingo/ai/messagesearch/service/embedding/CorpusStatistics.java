package com.flamingo.ai.messagesearch.service.embedding;

import java.util.Map;

/**
 * Immutable snapshot of corpus-wide term statistics: the document count and the inverse document
 * frequency of every term seen while the snapshot was built.
 *
 * <p>Terms missing from the snapshot weigh {@link #DEFAULT_IDF}.
 */
public final class CorpusStatistics {

  public static final double DEFAULT_IDF = 1.0;

  private static final CorpusStatistics EMPTY = new CorpusStatistics(0, Map.of());

  private final int totalDocuments;
  private final Map<String, Double> inverseDocumentFrequency;

  CorpusStatistics(int totalDocuments, Map<String, Double> inverseDocumentFrequency) {
    this.totalDocuments = totalDocuments;
    this.inverseDocumentFrequency = Map.copyOf(inverseDocumentFrequency);
  }

  /** Snapshot used before the first indexing run has completed its corpus rebuild. */
  public static CorpusStatistics empty() {
    return EMPTY;
  }

  public int getTotalDocuments() {
    return totalDocuments;
  }

  public int getUniqueTerms() {
    return inverseDocumentFrequency.size();
  }

  public double idf(String term) {
    return inverseDocumentFrequency.getOrDefault(term, DEFAULT_IDF);
  }

  public boolean contains(String term) {
    return inverseDocumentFrequency.containsKey(term);
  }

  public boolean isEmpty() {
    return totalDocuments == 0;
  }

  @Override
  public String toString() {
    return "CorpusStatistics{documents=" + totalDocuments + ", terms=" + getUniqueTerms() + "}";
  }
}
