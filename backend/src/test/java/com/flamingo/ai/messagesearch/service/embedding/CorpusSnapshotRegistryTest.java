package com.flamingo.ai.messagesearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorpusSnapshotRegistry Tests")
class CorpusSnapshotRegistryTest {

  private final SemanticSearchConfig config = new SemanticSearchConfig();
  private final CorpusSnapshotRegistry registry = new CorpusSnapshotRegistry(config);

  @Test
  @DisplayName("Should start with empty statistics and no publish time")
  void shouldStartEmpty() {
    assertThat(registry.current().isEmpty()).isTrue();
    assertThat(registry.describe())
        .containsEntry("totalDocuments", 0)
        .containsEntry("embeddingDimension", 384)
        .containsEntry("stopWordCount", 100)
        .containsEntry("publishedAt", null);
  }

  @Test
  @DisplayName("Should serve the latest published snapshot")
  void shouldServeLatestSnapshot() {
    CorpusStatisticsBuilder builder = new CorpusStatisticsBuilder(new Tokenizer(config));
    CorpusStatistics first = builder.build(List.of("pizza party"));
    CorpusStatistics second = builder.build(List.of("pizza party", "roof repair"));

    registry.publish(first);
    registry.publish(second);

    assertThat(registry.current()).isSameAs(second);
    Map<String, Object> description = registry.describe();
    assertThat(description).containsEntry("totalDocuments", 2).containsEntry("uniqueTerms", 4);
    assertThat(description.get("publishedAt")).isNotNull();
  }
}
