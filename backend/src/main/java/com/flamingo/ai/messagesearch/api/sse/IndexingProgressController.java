package com.flamingo.ai.messagesearch.api.sse;

import com.flamingo.ai.messagesearch.api.dto.response.IndexingStatusResponse;
import com.flamingo.ai.messagesearch.service.indexing.IndexingJobScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Streams indexing progress with Server-Sent Events. */
@RestController
@RequestMapping("/api/indexing")
@RequiredArgsConstructor
@Slf4j
public class IndexingProgressController {

  private final IndexingJobScheduler scheduler;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams progress updates of indexing runs, beginning with the latest one. The stream stays
   * open across runs until the client disconnects.
   *
   * @return a Flux of SSE events
   */
  @GetMapping(value = "/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<IndexingStatusResponse> streamProgress() {
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);
    log.debug("Progress stream opened");

    return scheduler
        .progressStream()
        .map(progress -> IndexingStatusResponse.of(!progress.isTerminal(), progress))
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Progress stream closed by client");
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Progress stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            });
  }
}
