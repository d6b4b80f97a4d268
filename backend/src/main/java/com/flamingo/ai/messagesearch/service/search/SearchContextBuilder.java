package com.flamingo.ai.messagesearch.service.search;

import com.flamingo.ai.messagesearch.config.SemanticSearchConfig;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Formats search results as readable text for callers that feed them to a language model. */
@Service
@Slf4j
public class SearchContextBuilder {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

  private final SimilaritySearchService searchService;
  private final SemanticSearchConfig config;
  private final ZoneId zone;

  @Autowired
  public SearchContextBuilder(SimilaritySearchService searchService, SemanticSearchConfig config) {
    this(searchService, config, ZoneId.systemDefault());
  }

  SearchContextBuilder(
      SimilaritySearchService searchService, SemanticSearchConfig config, ZoneId zone) {
    this.searchService = searchService;
    this.config = config;
    this.zone = zone;
  }

  /**
   * Builds a context block from the messages most relevant to the query.
   *
   * <p>Messages are appended best first until the next one would exceed the configured length.
   *
   * @param query free-text query
   * @return the context, or empty when no message passes the default threshold
   */
  public Optional<String> buildContext(String query) {
    SemanticSearchConfig.Search search = config.getSearch();
    List<SearchResult> results =
        searchService.search(SearchRequest.of(query, search.getContextMaxResults(), null));
    if (results.isEmpty()) {
      return Optional.empty();
    }

    StringBuilder context = new StringBuilder("Relevant messages:\n\n");
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      String entry =
          "Message "
              + (i + 1)
              + ":\nFrom: "
              + result.sender()
              + "\nDate: "
              + formatDate(result.timestamp())
              + "\nContent: "
              + result.snippet()
              + "\n\n";
      if (context.length() + entry.length() > search.getContextMaxLength()) {
        break;
      }
      context.append(entry);
    }
    return Optional.of(context.toString().trim());
  }

  /** Renders one result as a relevance/sender/date/message block. */
  public String formatResult(SearchResult result) {
    return "["
        + result.relevancePercent()
        + "% relevant]\nFrom: "
        + result.sender()
        + "\nDate: "
        + formatDate(result.timestamp())
        + "\nMessage: "
        + result.snippet();
  }

  private String formatDate(Long timestamp) {
    if (timestamp == null) {
      return "unknown";
    }
    return DATE_FORMAT.format(Instant.ofEpochMilli(timestamp).atZone(zone));
  }
}
