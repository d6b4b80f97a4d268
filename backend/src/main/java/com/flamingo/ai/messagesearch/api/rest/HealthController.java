package com.flamingo.ai.messagesearch.api.rest;

import com.flamingo.ai.messagesearch.service.embedding.CorpusSnapshotRegistry;
import com.flamingo.ai.messagesearch.service.message.MessageService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and index statistics. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final MessageService messageService;
  private final CorpusSnapshotRegistry snapshotRegistry;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "message-search");
    return ResponseEntity.ok(health);
  }

  /** Returns index coverage and the corpus snapshot in use by search. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    MessageService.IndexCoverage coverage = messageService.getCoverage();
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalMessages", coverage.totalMessages());
    stats.put("embeddedMessages", coverage.embeddedMessages());
    stats.put("pendingMessages", coverage.pendingMessages());
    stats.put("corpus", snapshotRegistry.describe());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
