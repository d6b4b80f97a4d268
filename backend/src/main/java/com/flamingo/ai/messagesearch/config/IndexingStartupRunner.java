package com.flamingo.ai.messagesearch.config;

import com.flamingo.ai.messagesearch.exception.IndexingRunActiveException;
import com.flamingo.ai.messagesearch.service.indexing.IndexingJobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Starts an indexing run once the application is up, so messages stored while the service was
 * down get embedded.
 *
 * <p>The corpus snapshot is only rebuilt when something is pending. After a restart with every
 * message already embedded, queries use empty statistics (every idf is 1) against vectors stored
 * with real idf weights until the next run that has work to do.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexingStartupRunner implements CommandLineRunner {

  private final IndexingJobScheduler scheduler;
  private final SemanticSearchConfig config;

  @Override
  public void run(String... args) {
    if (!config.getIndexing().isRunOnStartup()) {
      log.info("Startup indexing disabled");
      return;
    }
    try {
      scheduler.startRun();
      log.info("Startup indexing run submitted");
    } catch (IndexingRunActiveException e) {
      log.info("Indexing already active at startup, not starting another run");
    } catch (RuntimeException e) {
      // search keeps working on whatever is already embedded
      log.error("Startup indexing could not be submitted: {}", e.getMessage(), e);
    }
  }
}
