package com.flamingo.ai.messagesearch.service.embedding;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the corpus statistics published by the most recent indexing run.
 *
 * <p>Query embedding reads whatever snapshot is current. Statistics are only rebuilt by indexing
 * runs, so relevance can drift between runs as new messages arrive; queries never recompute them.
 * The snapshot starts out empty and a run with nothing pending does not rebuild it, so after a
 * restart queries weigh every term equally until a run embeds something.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusSnapshotRegistry {

  private final SemanticSearchConfig config;

  private final AtomicReference<CorpusStatistics> current =
      new AtomicReference<>(CorpusStatistics.empty());
  private final AtomicReference<Instant> publishedAt = new AtomicReference<>();

  public CorpusStatistics current() {
    return current.get();
  }

  /** Replaces the current snapshot. */
  public void publish(CorpusStatistics statistics) {
    current.set(statistics);
    publishedAt.set(Instant.now());
    log.info("Published corpus snapshot: {}", statistics);
  }

  /** Describes the current snapshot for monitoring. */
  public Map<String, Object> describe() {
    CorpusStatistics snapshot = current.get();
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("totalDocuments", snapshot.getTotalDocuments());
    stats.put("uniqueTerms", snapshot.getUniqueTerms());
    stats.put("embeddingDimension", config.getEmbedding().getDimension());
    stats.put("minTokenLength", config.getEmbedding().getMinTokenLength());
    stats.put("stopWordCount", Tokenizer.STOP_WORDS.size());
    stats.put("publishedAt", publishedAt.get());
    return stats;
  }
}
