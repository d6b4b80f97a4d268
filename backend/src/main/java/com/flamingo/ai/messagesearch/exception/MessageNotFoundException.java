package com.flamingo.ai.messagesearch.exception;

/** Exception thrown when a message is not found. */
public class MessageNotFoundException extends RuntimeException {

  private final Long messageId;

  public MessageNotFoundException(Long messageId) {
    super("Message not found: " + messageId);
    this.messageId = messageId;
  }

  public Long getMessageId() {
    return messageId;
  }
}
