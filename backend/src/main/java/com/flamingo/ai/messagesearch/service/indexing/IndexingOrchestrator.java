package com.flamingo.ai.messagesearch.service.indexing;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import com.flamingo.ai.messagesearch.domain.enums.IndexingState;
import com.flamingo.ai.messagesearch.exception.CorpusReadException;
import com.flamingo.ai.messagesearch.service.embedding.CorpusSnapshotRegistry;
import com.flamingo.ai.messagesearch.service.embedding.CorpusStatistics;
import com.flamingo.ai.messagesearch.service.embedding.CorpusStatisticsBuilder;
import com.flamingo.ai.messagesearch.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.messagesearch.service.store.MessageStore;
import com.flamingo.ai.messagesearch.service.store.PendingMessage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Brings every stored message up to date with an embedding of the current version.
 *
 * <p>A run scans for pending messages, rebuilds corpus statistics from all bodies, publishes them
 * for query-time use, then embeds pending messages in batches. A message that fails to embed or
 * persist is logged and left pending for the next run. Cancellation is checked between batches;
 * batches already written stay written. Only a failure to enumerate messages fails the run.
 *
 * <p>Callers must not start overlapping runs; {@link IndexingJobScheduler} guarantees this.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexingOrchestrator {

  private final MessageStore messageStore;
  private final CorpusStatisticsBuilder statisticsBuilder;
  private final CorpusSnapshotRegistry snapshotRegistry;
  private final EmbeddingGenerator embeddingGenerator;
  private final SemanticSearchConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Executes one indexing run on the calling thread.
   *
   * @param cancellationRequested polled before every batch
   * @param listener receives progress updates and the terminal state
   * @return the terminal progress of the run
   */
  public IndexingProgress run(
      BooleanSupplier cancellationRequested, IndexingProgressListener listener) {
    Timer.Sample sample = Timer.start(meterRegistry);
    IndexingProgress outcome;
    try {
      outcome = execute(cancellationRequested, listener);
    } catch (CorpusReadException e) {
      log.error("Indexing run failed: {}", e.getMessage(), e);
      outcome =
          new IndexingProgress(
              IndexingState.FAILED, 0, 0, 0, "Indexing failed: " + e.getCause().getMessage());
    }
    sample.stop(meterRegistry.timer("indexing.run"));
    meterRegistry
        .counter("indexing.runs", "outcome", outcome.state().name().toLowerCase())
        .increment();
    report(listener, outcome);
    return outcome;
  }

  private IndexingProgress execute(
      BooleanSupplier cancellationRequested, IndexingProgressListener listener) {
    int version = config.getEmbedding().getVersion();
    report(listener, new IndexingProgress(IndexingState.SCANNING, 0, 0, 0, "Scanning messages"));

    List<Long> pendingIds = readCorpus(() -> messageStore.findIdsNeedingEmbedding(version));
    int total = pendingIds.size();
    if (total == 0) {
      log.info("No messages need embedding");
      return new IndexingProgress(
          IndexingState.COMPLETED, 0, 0, 0, "All messages are already indexed");
    }
    log.info("Found {} messages needing embeddings", total);

    if (cancellationRequested.getAsBoolean()) {
      return cancelled(0, 0, total);
    }

    report(
        listener,
        new IndexingProgress(
            IndexingState.CORPUS_REBUILD, 0, 0, total, "Rebuilding corpus statistics"));
    List<String> bodies = readCorpus(messageStore::loadAllBodies);
    CorpusStatistics statistics = statisticsBuilder.build(bodies);
    snapshotRegistry.publish(statistics);
    log.info("Corpus updated with {} documents", statistics.getTotalDocuments());

    int batchSize = config.getIndexing().getBatchSize();
    int progressInterval = config.getIndexing().getProgressInterval();
    int processed = 0;
    int failed = 0;

    for (int start = 0; start < total; start += batchSize) {
      if (cancellationRequested.getAsBoolean()) {
        log.info("Indexing cancelled after {} / {} messages", processed, total);
        return cancelled(processed, failed, total);
      }
      List<Long> batchIds = pendingIds.subList(start, Math.min(start + batchSize, total));

      List<PendingMessage> batch;
      try {
        batch = messageStore.loadPending(batchIds);
      } catch (RuntimeException e) {
        log.warn("Failed to load batch of {} messages: {}", batchIds.size(), e.getMessage());
        failed += batchIds.size();
        meterRegistry.counter("indexing.items.failure").increment(batchIds.size());
        continue;
      }

      for (PendingMessage message : batch) {
        if (embedAndStore(message, statistics, version)) {
          processed++;
        } else {
          failed++;
        }
        if ((processed + failed) % progressInterval == 0) {
          report(listener, batchProgress(processed, failed, total));
        }
      }

      log.debug("Processed batch: {} / {} messages", processed, total);
      report(listener, batchProgress(processed, failed, total));
    }

    String summary =
        failed == 0
            ? String.format("Indexing complete! %d messages indexed", processed)
            : String.format(
                "Indexing complete! %d messages indexed, %d will be retried", processed, failed);
    log.info("Embedding generation complete: {} / {} messages", processed, total);
    return new IndexingProgress(IndexingState.COMPLETED, processed, failed, total, summary);
  }

  private boolean embedAndStore(PendingMessage message, CorpusStatistics statistics, int version) {
    try {
      float[] vector = embeddingGenerator.embed(message.body(), statistics);
      boolean stored =
          messageStore.updateEmbedding(
              message.id(),
              message.body(),
              embeddingGenerator.toStorageForm(vector),
              version,
              System.currentTimeMillis());
      if (!stored) {
        log.debug("Message {} was edited during indexing, leaving it pending", message.id());
        meterRegistry.counter("indexing.items.stale").increment();
        return false;
      }
      meterRegistry.counter("indexing.items.success").increment();
      return true;
    } catch (RuntimeException e) {
      log.warn("Failed to generate embedding for message {}: {}", message.id(), e.getMessage());
      meterRegistry.counter("indexing.items.failure").increment();
      return false;
    }
  }

  private <T> T readCorpus(Supplier<T> read) {
    try {
      return read.get();
    } catch (RuntimeException e) {
      throw new CorpusReadException("Cannot enumerate messages", e);
    }
  }

  private IndexingProgress batchProgress(int processed, int failed, int total) {
    return new IndexingProgress(
        IndexingState.BATCH_PROCESSING,
        processed,
        failed,
        total,
        String.format("Indexed %d / %d messages", processed, total));
  }

  private IndexingProgress cancelled(int processed, int failed, int total) {
    return new IndexingProgress(
        IndexingState.CANCELLED,
        processed,
        failed,
        total,
        String.format("Indexing cancelled after %d / %d messages", processed, total));
  }

  private void report(IndexingProgressListener listener, IndexingProgress progress) {
    try {
      listener.onProgress(progress);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed: {}", e.getMessage());
    }
  }
}
