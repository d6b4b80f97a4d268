package com.flamingo.ai.messagesearch.exception;

/** Exception thrown when an indexing run is requested while another one is active. */
public class IndexingRunActiveException extends RuntimeException {

  public IndexingRunActiveException() {
    super("An indexing run is already active");
  }
}
