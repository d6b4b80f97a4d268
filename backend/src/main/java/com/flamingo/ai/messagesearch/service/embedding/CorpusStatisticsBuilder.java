package com.flamingo.ai.messagesearch.service.embedding;

import io.micrometer.core.annotation.Timed;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes inverse document frequencies over every message body.
 *
 * <p>{@code idf(t) = ln((N + 1) / (df(t) + 1)) + 1}, where N is the number of bodies and df(t) the
 * number of bodies containing t at least once. The result is never below 1.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusStatisticsBuilder {

  private final Tokenizer tokenizer;

  /**
   * Builds a snapshot from the given bodies. Null bodies count as empty documents.
   *
   * @param bodies every message body of the corpus
   * @return immutable statistics snapshot
   */
  @Timed(value = "corpus.rebuild", description = "Time to rebuild corpus statistics")
  public CorpusStatistics build(Iterable<String> bodies) {
    Map<String, Integer> documentFrequency = new HashMap<>();
    int totalDocuments = 0;

    for (String body : bodies) {
      totalDocuments++;
      Set<String> distinct = new HashSet<>(tokenizer.tokenize(body));
      for (String term : distinct) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    Map<String, Double> idf = new HashMap<>(documentFrequency.size() * 2);
    for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
      idf.put(entry.getKey(), inverseDocumentFrequency(totalDocuments, entry.getValue()));
    }

    log.debug(
        "Corpus statistics built: {} documents, {} unique terms", totalDocuments, idf.size());
    return new CorpusStatistics(totalDocuments, idf);
  }

  static double inverseDocumentFrequency(int totalDocuments, int documentFrequency) {
    return Math.log((totalDocuments + 1.0) / (documentFrequency + 1.0)) + 1.0;
  }
}
