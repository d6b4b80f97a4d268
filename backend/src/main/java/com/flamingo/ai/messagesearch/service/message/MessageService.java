package com.flamingo.ai.messagesearch.service.message;

import com.flamingo.ai.messagesearch.domain.entity.Message;
import com.flamingo.ai.messagesearch.exception.MessageNotFoundException;

/** Service for storing messages and reporting how much of the store is indexed. */
public interface MessageService {

  /** Index coverage of the message store. */
  record IndexCoverage(long totalMessages, long embeddedMessages) {

    public long pendingMessages() {
      return totalMessages - embeddedMessages;
    }
  }

  /**
   * Stores a new message without an embedding; the next indexing run embeds it.
   *
   * @return the persisted message
   */
  Message createMessage(Long threadId, String sender, String body, Long timestamp);

  /**
   * Gets a message by ID.
   *
   * @throws MessageNotFoundException if no message has this id
   */
  Message getMessage(Long messageId);

  /**
   * Replaces the body of a message and clears its embedding so it is re-embedded.
   *
   * @throws MessageNotFoundException if no message has this id
   */
  Message updateBody(Long messageId, String body);

  IndexCoverage getCoverage();
}
