package com.flamingo.ai.messagesearch.api.rest;

import com.flamingo.ai.messagesearch.api.dto.response.SearchResponse;
import com.flamingo.ai.messagesearch.service.search.SearchContextBuilder;
import com.flamingo.ai.messagesearch.service.search.SearchRequest;
import com.flamingo.ai.messagesearch.service.search.SearchResult;
import com.flamingo.ai.messagesearch.service.search.SimilaritySearchService;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for semantic message search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

  private final SimilaritySearchService searchService;
  private final SearchContextBuilder contextBuilder;

  /** Searches messages by meaning. Out-of-range limits are clamped. */
  @GetMapping
  public ResponseEntity<SearchResponse> search(
      @RequestParam String query,
      @RequestParam(required = false) Integer maxResults,
      @RequestParam(required = false) Float threshold) {
    SearchRequest request = SearchRequest.of(query, maxResults, threshold);
    return ResponseEntity.ok(execute(request));
  }

  /**
   * Searches with tool-style arguments: {@code query}, {@code max_results} and {@code
   * similarity_threshold}.
   */
  @PostMapping
  public ResponseEntity<SearchResponse> searchWithArguments(
      @RequestBody Map<String, Object> arguments) {
    SearchRequest request = SearchRequest.fromArguments(arguments);
    return ResponseEntity.ok(execute(request));
  }

  /** Returns the most relevant messages as a formatted context block. */
  @GetMapping("/context")
  public ResponseEntity<Map<String, Object>> context(@RequestParam String query) {
    Optional<String> context = contextBuilder.buildContext(query);
    Map<String, Object> body = new HashMap<>();
    body.put("query", query);
    body.put("found", context.isPresent());
    body.put("context", context.orElse(null));
    return ResponseEntity.ok(body);
  }

  private SearchResponse execute(SearchRequest request) {
    List<SearchResult> results = searchService.search(request);
    log.debug("Search complete: {} results found", results.size());
    return SearchResponse.of(request, results);
  }
}
