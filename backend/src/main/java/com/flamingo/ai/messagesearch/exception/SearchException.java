package com.flamingo.ai.messagesearch.exception;

/** Exception thrown when stored embeddings cannot be read during a similarity scan. */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Message search is temporarily unavailable. Please try again.";

  private final long lastScannedId;

  public SearchException(long lastScannedId, Throwable cause) {
    super("Failed to read stored embeddings after message " + lastScannedId, cause);
    this.lastScannedId = lastScannedId;
  }

  /** Highest message id compared before the failure, 0 if none. */
  public long getLastScannedId() {
    return lastScannedId;
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
