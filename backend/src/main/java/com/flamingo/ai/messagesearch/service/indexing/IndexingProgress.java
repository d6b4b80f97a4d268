package com.flamingo.ai.messagesearch.service.indexing;

import com.flamingo.ai.messagesearch.domain.enums.IndexingState;

/**
 * Snapshot of an indexing run.
 *
 * @param state current or terminal state
 * @param processed messages embedded and persisted so far
 * @param failed messages skipped because embedding or persistence failed
 * @param total messages pending when the run started
 * @param message human-readable status
 */
public record IndexingProgress(
    IndexingState state, int processed, int failed, int total, String message) {

  public static IndexingProgress idle() {
    return new IndexingProgress(IndexingState.IDLE, 0, 0, 0, "No indexing run has started");
  }

  /** Published when a run is submitted, before it has scanned anything. */
  public static IndexingProgress starting() {
    return new IndexingProgress(IndexingState.SCANNING, 0, 0, 0, "Indexing run starting");
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  /** Fraction of pending messages attempted, 1.0 when nothing was pending. */
  public float fraction() {
    return total == 0 ? 1.0f : (float) (processed + failed) / total;
  }
}
