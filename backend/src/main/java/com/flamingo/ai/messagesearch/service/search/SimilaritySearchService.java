package com.flamingo.ai.messagesearch.service.search;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import com.flamingo.ai.messagesearch.exception.SearchException;
import com.flamingo.ai.messagesearch.service.embedding.CorpusSnapshotRegistry;
import com.flamingo.ai.messagesearch.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.messagesearch.service.embedding.VectorMath;
import com.flamingo.ai.messagesearch.service.store.EmbeddedMessageCandidate;
import com.flamingo.ai.messagesearch.service.store.MessageStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds messages whose stored embedding is close to the embedding of a query.
 *
 * <p>Stored vectors are streamed from the {@link MessageStore} in keyset batches, so at most one
 * batch of serialized vectors is held at a time. There is no index structure: every embedded
 * message is compared once per query. Messages that are not embedded yet are simply not
 * candidates, stored vectors that fail to parse are skipped, and zero vectors never match.
 *
 * <p>Results are ordered by similarity, then newer timestamp, then higher id. The order is total,
 * so a larger {@code maxResults} only ever extends a smaller one's result list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilaritySearchService {

  static final Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::similarity)
          .reversed()
          .thenComparing(
              SearchResult::timestamp, Comparator.nullsLast(Comparator.<Long>reverseOrder()))
          .thenComparing(
              SearchResult::messageId, Comparator.nullsLast(Comparator.<Long>reverseOrder()));

  private final MessageStore messageStore;
  private final EmbeddingGenerator embeddingGenerator;
  private final CorpusSnapshotRegistry snapshotRegistry;
  private final SemanticSearchConfig config;
  private final MeterRegistry meterRegistry;

  /** Searches with default limits and threshold. */
  public List<SearchResult> search(String query) {
    return search(SearchRequest.of(query, null, null));
  }

  /**
   * Runs a similarity scan for the request.
   *
   * @param request validated request
   * @return at most {@code request.maxResults()} results, best first, all with similarity at
   *     least {@code request.threshold()}
   * @throws SearchException if stored messages cannot be read
   */
  @Timed(value = "search.duration", description = "Time for a similarity scan")
  public List<SearchResult> search(SearchRequest request) {
    meterRegistry.counter("search.requests").increment();
    log.debug(
        "Searching messages (threshold: {}, max: {})", request.threshold(), request.maxResults());

    float[] queryVector = embeddingGenerator.embed(request.query(), snapshotRegistry.current());
    if (VectorMath.isZero(queryVector)) {
      log.debug("Query has no indexable tokens, returning no results");
      return List.of();
    }

    // min-heap on ranking: the head is the weakest of the retained results
    PriorityQueue<SearchResult> retained =
        new PriorityQueue<>(request.maxResults() + 1, RANKING.reversed());
    int batchSize = config.getSearch().getBatchSize();
    long afterId = 0L;
    int scanned = 0;
    int matched = 0;
    int corrupt = 0;

    while (true) {
      List<EmbeddedMessageCandidate> batch = fetchBatch(afterId, batchSize);
      if (batch.isEmpty()) {
        break;
      }
      for (EmbeddedMessageCandidate candidate : batch) {
        afterId = Math.max(afterId, candidate.id());
        if (candidate.embedding() == null) {
          continue;
        }
        scanned++;
        Optional<float[]> vector = embeddingGenerator.fromStorageForm(candidate.embedding());
        if (vector.isEmpty()) {
          corrupt++;
          log.warn("Skipping message {} with unreadable embedding", candidate.id());
          continue;
        }
        if (VectorMath.isZero(vector.get())) {
          // message had no indexable tokens
          continue;
        }
        float similarity = VectorMath.cosineSimilarity(queryVector, vector.get());
        if (similarity < request.threshold()) {
          continue;
        }
        matched++;
        retained.offer(toResult(candidate, similarity));
        if (retained.size() > request.maxResults()) {
          retained.poll();
        }
      }
      if (batch.size() < batchSize) {
        break;
      }
    }

    if (corrupt > 0) {
      meterRegistry.counter("search.corrupt_embeddings").increment(corrupt);
    }

    List<SearchResult> results = new ArrayList<>(retained);
    results.sort(RANKING);
    log.debug(
        "Scanned {} embedded messages, {} above threshold, returning {}",
        scanned,
        matched,
        results.size());
    return results;
  }

  private List<EmbeddedMessageCandidate> fetchBatch(long afterId, int batchSize) {
    try {
      return messageStore.fetchEmbeddedBatch(afterId, batchSize);
    } catch (RuntimeException e) {
      throw new SearchException(afterId, e);
    }
  }

  private SearchResult toResult(EmbeddedMessageCandidate candidate, float similarity) {
    return new SearchResult(
        candidate.id(),
        candidate.threadId(),
        candidate.sender(),
        candidate.timestamp(),
        snippet(candidate.body()),
        similarity);
  }

  private String snippet(String body) {
    if (body == null) {
      return "";
    }
    int limit = config.getSearch().getSnippetLength();
    if (body.length() <= limit) {
      return body;
    }
    // keep surrogate pairs whole
    int end = Character.isHighSurrogate(body.charAt(limit - 1)) ? limit - 1 : limit;
    return body.substring(0, end) + "...";
  }
}
