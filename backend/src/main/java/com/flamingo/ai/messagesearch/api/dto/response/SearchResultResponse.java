package com.flamingo.ai.messagesearch.api.dto.response;

import com.flamingo.ai.messagesearch.service.search.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private Long messageId;
  private Long threadId;
  private String sender;
  private Long timestamp;
  private String snippet;
  private float similarity;
  private int relevancePercent;

  public static SearchResultResponse fromResult(SearchResult result) {
    return SearchResultResponse.builder()
        .messageId(result.messageId())
        .threadId(result.threadId())
        .sender(result.sender())
        .timestamp(result.timestamp())
        .snippet(result.snippet())
        .similarity(result.similarity())
        .relevancePercent(result.relevancePercent())
        .build();
  }
}
