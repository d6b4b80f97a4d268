package com.flamingo.ai.messagesearch.exception;

/** Exception raised when stored messages cannot be enumerated for an indexing run. */
public class CorpusReadException extends RuntimeException {

  public CorpusReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
