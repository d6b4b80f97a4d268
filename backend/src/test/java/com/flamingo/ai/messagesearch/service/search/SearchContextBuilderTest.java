package com.flamingo.ai.messagesearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchContextBuilder Tests")
class SearchContextBuilderTest {

  // 2023-11-14T22:13:20Z
  private static final long TIMESTAMP = 1_700_000_000_000L;

  @Mock private SimilaritySearchService searchService;

  private SemanticSearchConfig config;
  private SearchContextBuilder contextBuilder;

  @BeforeEach
  void setUp() {
    config = new SemanticSearchConfig();
    contextBuilder = new SearchContextBuilder(searchService, config, ZoneId.of("UTC"));
  }

  private static SearchResult result(long id, String sender, String snippet, float similarity) {
    return new SearchResult(id, 1L, sender, TIMESTAMP, snippet, similarity);
  }

  @Test
  @DisplayName("Should number messages best first with sender and date")
  void shouldFormatContext() {
    when(searchService.search(any(SearchRequest.class)))
        .thenReturn(
            List.of(
                result(4L, "alice", "The gate code is 4521", 0.9f),
                result(2L, "bob", "Gate opens at 8", 0.4f)));

    Optional<String> context = contextBuilder.buildContext("gate code");

    assertThat(context)
        .contains(
            "Relevant messages:\n\n"
                + "Message 1:\nFrom: alice\nDate: Nov 14, 2023 at 10:13 PM\n"
                + "Content: The gate code is 4521\n\n"
                + "Message 2:\nFrom: bob\nDate: Nov 14, 2023 at 10:13 PM\n"
                + "Content: Gate opens at 8");
    verify(searchService).search(SearchRequest.of("gate code", 3, null));
  }

  @Test
  @DisplayName("Should stop before exceeding the context length")
  void shouldRespectMaxLength() {
    config.getSearch().setContextMaxLength(200);
    when(searchService.search(any(SearchRequest.class)))
        .thenReturn(
            List.of(
                result(1L, "alice", "a".repeat(50), 0.9f),
                result(2L, "alice", "b".repeat(50), 0.8f)));

    String context = contextBuilder.buildContext("anything").orElseThrow();

    assertThat(context).contains("Message 1:").doesNotContain("Message 2:");
    assertThat(context.length()).isLessThanOrEqualTo(200);
  }

  @Test
  @DisplayName("Should return empty when nothing is relevant")
  void shouldReturnEmptyWithoutResults() {
    when(searchService.search(any(SearchRequest.class))).thenReturn(List.of());

    assertThat(contextBuilder.buildContext("nothing matches")).isEmpty();
  }

  @Test
  @DisplayName("Should render a single result with its relevance")
  void shouldFormatSingleResult() {
    String formatted = contextBuilder.formatResult(result(1L, "alice", "See you there", 0.876f));

    assertThat(formatted)
        .isEqualTo(
            "[87% relevant]\nFrom: alice\nDate: Nov 14, 2023 at 10:13 PM\nMessage: See you there");
  }

  @Test
  @DisplayName("Should render unknown dates")
  void shouldRenderUnknownDate() {
    SearchResult undated = new SearchResult(1L, 1L, "alice", null, "hi", 0.5f);

    assertThat(contextBuilder.formatResult(undated)).contains("Date: unknown");
  }
}
