package com.flamingo.ai.messagesearch.domain.enums;

/** Lifecycle states of an indexing run. */
public enum IndexingState {
  /** No run has started yet. */
  IDLE,

  /** Looking for messages without a current embedding. */
  SCANNING,

  /** Recomputing corpus statistics from every message body. */
  CORPUS_REBUILD,

  /** Embedding and persisting pending messages batch by batch. */
  BATCH_PROCESSING,

  /** Every pending message was attempted. */
  COMPLETED,

  /** Stopped at a batch boundary on request; finished batches stay persisted. */
  CANCELLED,

  /** Messages could not be enumerated. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
