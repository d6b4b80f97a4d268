package com.flamingo.ai.messagesearch.exception;

/** Exception thrown when search arguments cannot be turned into a valid request. */
public class InvalidSearchRequestException extends RuntimeException {

  public InvalidSearchRequestException(String message) {
    super(message);
  }
}
