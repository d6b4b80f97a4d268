package com.flamingo.ai.messagesearch.service.search;

import com.flamingo.ai.messagesearch.exception.InvalidSearchRequestException;
import java.util.Map;

/**
 * A validated search request. {@code maxResults} is within {@code [1, MAX_RESULTS_LIMIT]} and
 * {@code threshold} within {@code [0, 1]}.
 *
 * @param query free-text query, never blank
 * @param maxResults number of results to return at most
 * @param threshold minimum cosine similarity of a returned message
 */
public record SearchRequest(String query, int maxResults, float threshold) {

  public static final int DEFAULT_MAX_RESULTS = 5;
  public static final int MAX_RESULTS_LIMIT = 20;
  public static final float DEFAULT_THRESHOLD = 0.15f;

  public static final String ARG_QUERY = "query";
  public static final String ARG_MAX_RESULTS = "max_results";
  public static final String ARG_THRESHOLD = "similarity_threshold";

  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new InvalidSearchRequestException("Query cannot be empty");
    }
    maxResults = Math.max(1, Math.min(MAX_RESULTS_LIMIT, maxResults));
    threshold = Float.isNaN(threshold) ? DEFAULT_THRESHOLD : Math.max(0f, Math.min(1f, threshold));
  }

  /** Builds a request, substituting defaults for missing values. */
  public static SearchRequest of(String query, Integer maxResults, Float threshold) {
    return new SearchRequest(
        query,
        maxResults != null ? maxResults : DEFAULT_MAX_RESULTS,
        threshold != null ? threshold : DEFAULT_THRESHOLD);
  }

  /**
   * Converts loosely-typed call arguments into a request.
   *
   * <p>{@code query} must be a non-blank string. {@code max_results} and {@code
   * similarity_threshold} accept any number or numeric string; absent values take the defaults.
   *
   * @throws InvalidSearchRequestException if the query is missing or a value is not numeric
   */
  public static SearchRequest fromArguments(Map<String, ?> arguments) {
    if (arguments == null) {
      throw new InvalidSearchRequestException("Missing required parameter: query");
    }
    Object query = arguments.get(ARG_QUERY);
    if (!(query instanceof String text)) {
      throw new InvalidSearchRequestException("Missing required parameter: query");
    }
    Number maxResults = toNumber(arguments.get(ARG_MAX_RESULTS), ARG_MAX_RESULTS);
    Number threshold = toNumber(arguments.get(ARG_THRESHOLD), ARG_THRESHOLD);
    return of(
        text,
        maxResults != null ? maxResults.intValue() : null,
        threshold != null ? threshold.floatValue() : null);
  }

  private static Number toNumber(Object value, String name) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number;
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return Double.valueOf(text.trim());
      } catch (NumberFormatException e) {
        throw new InvalidSearchRequestException("Parameter " + name + " must be a number");
      }
    }
    throw new InvalidSearchRequestException("Parameter " + name + " must be a number");
  }
}
