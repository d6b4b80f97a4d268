package com.flamingo.ai.messagesearch.service.indexing;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import com.flamingo.ai.messagesearch.domain.enums.IndexingState;
import com.flamingo.ai.messagesearch.exception.IndexingRunActiveException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Starts indexing runs in the background and tracks their progress.
 *
 * <p>At most one run is active at a time. Progress is kept as the latest snapshot and replayed to
 * stream subscribers.
 */
@Service
@Slf4j
public class IndexingJobScheduler {

  private final IndexingOrchestrator orchestrator;
  private final SemanticSearchConfig config;
  private final Executor indexingExecutor;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
  private final AtomicReference<IndexingProgress> latest =
      new AtomicReference<>(IndexingProgress.idle());
  private final Sinks.Many<IndexingProgress> progressSink = Sinks.many().replay().latest();

  public IndexingJobScheduler(
      IndexingOrchestrator orchestrator,
      SemanticSearchConfig config,
      @Qualifier("indexingExecutor") Executor indexingExecutor) {
    this.orchestrator = orchestrator;
    this.config = config;
    this.indexingExecutor = indexingExecutor;
  }

  /**
   * Submits a new indexing run.
   *
   * @return the progress snapshot at submission time
   * @throws IndexingRunActiveException if a run is already active
   */
  public IndexingProgress startRun() {
    if (!running.compareAndSet(false, true)) {
      throw new IndexingRunActiveException();
    }
    cancelRequested.set(false);
    IndexingProgress previous = latest.get();
    publish(IndexingProgress.starting());
    try {
      indexingExecutor.execute(this::runToCompletion);
    } catch (RejectedExecutionException e) {
      publish(previous);
      running.set(false);
      throw e;
    }
    log.info("Indexing run submitted");
    return latest.get();
  }

  /**
   * Asks the active run to stop at its next batch boundary.
   *
   * @return true if a run was active
   */
  public boolean requestCancellation() {
    if (!running.get()) {
      return false;
    }
    cancelRequested.set(true);
    log.info("Cancellation requested for active indexing run");
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  public IndexingProgress currentProgress() {
    return latest.get();
  }

  /** Progress updates, starting with the latest known snapshot. */
  public Flux<IndexingProgress> progressStream() {
    return progressSink.asFlux();
  }

  /** Periodic run, active only when scheduling is enabled. */
  @Scheduled(
      initialDelayString = "${semantic-search.indexing.schedule-interval-ms:900000}",
      fixedDelayString = "${semantic-search.indexing.schedule-interval-ms:900000}")
  public void scheduledRun() {
    if (!config.getIndexing().isScheduleEnabled() || running.get()) {
      return;
    }
    try {
      startRun();
    } catch (IndexingRunActiveException e) {
      log.debug("Skipping scheduled indexing run: {}", e.getMessage());
    }
  }

  private void runToCompletion() {
    try {
      orchestrator.run(cancelRequested::get, this::publish);
    } catch (RuntimeException e) {
      log.error("Indexing run aborted: {}", e.getMessage(), e);
      IndexingProgress current = latest.get();
      publish(
          new IndexingProgress(
              IndexingState.FAILED,
              current.processed(),
              current.failed(),
              current.total(),
              "Indexing failed: " + e.getMessage()));
    } finally {
      running.set(false);
    }
  }

  private void publish(IndexingProgress progress) {
    latest.set(progress);
    Sinks.EmitResult result = progressSink.tryEmitNext(progress);
    if (result.isFailure()) {
      log.debug("Dropped progress update: {}", result);
    }
  }
}
