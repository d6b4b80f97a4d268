package com.flamingo.ai.messagesearch.api.rest;

import com.flamingo.ai.messagesearch.api.dto.response.IndexingStatusResponse;
import com.flamingo.ai.messagesearch.service.indexing.IndexingJobScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for starting, cancelling and observing indexing runs. */
@RestController
@RequestMapping("/api/indexing")
@RequiredArgsConstructor
@Slf4j
public class IndexingController {

  private final IndexingJobScheduler scheduler;

  /** Starts a background indexing run. Responds 409 if one is already active. */
  @PostMapping("/runs")
  public ResponseEntity<IndexingStatusResponse> startRun() {
    log.info("Indexing run requested");
    scheduler.startRun();
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
  }

  /** Requests cancellation of the active run. Responds 404 if nothing is running. */
  @DeleteMapping("/runs/current")
  public ResponseEntity<IndexingStatusResponse> cancelRun() {
    if (!scheduler.requestCancellation()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
  }

  /** Returns the latest progress snapshot. */
  @GetMapping("/status")
  public ResponseEntity<IndexingStatusResponse> getStatus() {
    return ResponseEntity.ok(status());
  }

  private IndexingStatusResponse status() {
    return IndexingStatusResponse.of(scheduler.isRunning(), scheduler.currentProgress());
  }
}
