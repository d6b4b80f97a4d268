package com.flamingo.ai.messagesearch.service.message;

import com.flamingo.ai.messagesearch.domain.entity.Message;
import com.flamingo.ai.messagesearch.domain.repository.MessageRepository;
import com.flamingo.ai.messagesearch.exception.MessageNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of MessageService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageServiceImpl implements MessageService {

  private final MessageRepository messageRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public Message createMessage(Long threadId, String sender, String body, Long timestamp) {
    Message message =
        Message.builder()
            .threadId(threadId)
            .sender(sender)
            .body(body)
            .timestamp(timestamp != null ? timestamp : System.currentTimeMillis())
            .build();
    Message saved = messageRepository.save(message);
    meterRegistry.counter("messages.created").increment();
    log.debug("Stored message {} in thread {}", saved.getId(), threadId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Message getMessage(Long messageId) {
    return messageRepository
        .findById(messageId)
        .orElseThrow(() -> new MessageNotFoundException(messageId));
  }

  @Override
  @Transactional
  public Message updateBody(Long messageId, String body) {
    Message message = getMessage(messageId);
    message.setBody(body);
    messageRepository.saveAndFlush(message);
    messageRepository.clearEmbedding(messageId);
    log.debug("Body of message {} replaced, embedding cleared", messageId);
    return getMessage(messageId);
  }

  @Override
  @Transactional(readOnly = true)
  public IndexCoverage getCoverage() {
    return new IndexCoverage(messageRepository.count(), messageRepository.countEmbedded());
  }
}
