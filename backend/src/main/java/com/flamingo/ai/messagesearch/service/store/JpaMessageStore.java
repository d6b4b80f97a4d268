package com.flamingo.ai.messagesearch.service.store;

import com.flamingo.ai.messagesearch.domain.repository.MessageRepository;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** {@link MessageStore} backed by the JPA message table. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaMessageStore implements MessageStore {

  private final MessageRepository messageRepository;

  @Override
  @Transactional(readOnly = true)
  public List<String> loadAllBodies() {
    return messageRepository.findAllBodies();
  }

  @Override
  @Transactional(readOnly = true)
  public List<Long> findIdsNeedingEmbedding(int embeddingVersion) {
    return messageRepository.findIdsNeedingEmbedding(embeddingVersion);
  }

  @Override
  @Transactional(readOnly = true)
  public List<PendingMessage> loadPending(List<Long> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    return messageRepository.findPendingByIds(ids);
  }

  @Override
  @Transactional(readOnly = true)
  public List<EmbeddedMessageCandidate> fetchEmbeddedBatch(long afterId, int limit) {
    return messageRepository.findEmbeddedAfter(afterId, PageRequest.ofSize(limit));
  }

  @Override
  @Retry(name = "messageStore")
  @Transactional
  public boolean updateEmbedding(
      long messageId, String sourceBody, String embedding, int embeddingVersion, long lastIndexed) {
    int updated =
        messageRepository.updateEmbedding(
            messageId, sourceBody, embedding, embeddingVersion, lastIndexed);
    if (updated == 0) {
      log.debug("Message {} changed or disappeared before its embedding was stored", messageId);
      return false;
    }
    return true;
  }

  @Override
  @Transactional(readOnly = true)
  public long countMessages() {
    return messageRepository.count();
  }

  @Override
  @Transactional(readOnly = true)
  public long countEmbedded() {
    return messageRepository.countEmbedded();
  }
}
