package com.flamingo.ai.messagesearch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.messagesearch.service.embedding.CorpusSnapshotRegistry;
import com.flamingo.ai.messagesearch.service.indexing.IndexingJobScheduler;
import com.flamingo.ai.messagesearch.service.message.MessageService;
import com.flamingo.ai.messagesearch.service.search.SearchContextBuilder;
import com.flamingo.ai.messagesearch.service.search.SimilaritySearchService;
import com.flamingo.ai.messagesearch.service.store.MessageStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies the Spring application context loads against the test SQLite database. */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(MessageService.class)).isNotNull();
    assertThat(applicationContext.getBean(MessageStore.class)).isNotNull();
    assertThat(applicationContext.getBean(SimilaritySearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(SearchContextBuilder.class)).isNotNull();
    assertThat(applicationContext.getBean(IndexingJobScheduler.class)).isNotNull();
    assertThat(applicationContext.getBean(CorpusSnapshotRegistry.class)).isNotNull();
  }

  @Test
  @DisplayName("Startup indexing should be disabled for tests")
  void startupIndexingShouldBeDisabled() {
    assertThat(applicationContext.getBean(IndexingJobScheduler.class).isRunning()).isFalse();
  }
}
