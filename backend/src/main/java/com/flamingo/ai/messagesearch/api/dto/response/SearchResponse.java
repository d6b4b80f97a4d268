package com.flamingo.ai.messagesearch.api.dto.response;

import com.flamingo.ai.messagesearch.service.search.SearchRequest;
import com.flamingo.ai.messagesearch.service.search.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a semantic search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  static final String NO_RESULTS_HINT =
      "No messages found matching the query. Try lowering the similarity threshold or using"
          + " different search terms.";

  private String query;
  private float threshold;
  private int maxResults;
  private boolean found;
  private int count;
  private String message;
  private List<SearchResultResponse> results;

  public static SearchResponse of(SearchRequest request, List<SearchResult> results) {
    return SearchResponse.builder()
        .query(request.query())
        .threshold(request.threshold())
        .maxResults(request.maxResults())
        .found(!results.isEmpty())
        .count(results.size())
        .message(results.isEmpty() ? NO_RESULTS_HINT : null)
        .results(results.stream().map(SearchResultResponse::fromResult).toList())
        .build();
  }
}
