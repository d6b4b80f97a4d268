package com.flamingo.ai.messagesearch.api.dto.response;

import com.flamingo.ai.messagesearch.domain.enums.IndexingState;
import com.flamingo.ai.messagesearch.service.indexing.IndexingProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the state of indexing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingStatusResponse {

  private boolean running;
  private IndexingState state;
  private int processed;
  private int failed;
  private int total;
  private float progress;
  private String message;

  public static IndexingStatusResponse of(boolean running, IndexingProgress progress) {
    return IndexingStatusResponse.builder()
        .running(running)
        .state(progress.state())
        .processed(progress.processed())
        .failed(progress.failed())
        .total(progress.total())
        .progress(progress.fraction())
        .message(progress.message())
        .build();
  }
}
