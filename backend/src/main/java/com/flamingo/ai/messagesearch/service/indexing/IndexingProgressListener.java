package com.flamingo.ai.messagesearch.service.indexing;

/** Receives progress updates from an indexing run, including the terminal one. */
@FunctionalInterface
public interface IndexingProgressListener {

  IndexingProgressListener NONE = progress -> {};

  void onProgress(IndexingProgress progress);
}
