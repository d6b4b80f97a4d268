package com.flamingo.ai.messagesearch.service.store;

import java.util.List;

/**
 * Message storage as seen by indexing and search.
 *
 * <p>Implementations must make {@link #updateEmbedding} a single atomic write so concurrent
 * readers never see a partially written embedding group.
 */
public interface MessageStore {

  /** Returns the body of every stored message. */
  List<String> loadAllBodies();

  /** Returns ids of messages lacking an embedding of the given version, newest first. */
  List<Long> findIdsNeedingEmbedding(int embeddingVersion);

  /** Loads the bodies of the given messages. Ids that no longer exist are omitted. */
  List<PendingMessage> loadPending(List<Long> ids);

  /**
   * Returns up to {@code limit} embedded messages whose id is greater than {@code afterId}, in
   * ascending id order.
   */
  List<EmbeddedMessageCandidate> fetchEmbeddedBatch(long afterId, int limit);

  /**
   * Atomically stores embedding, version and index time for one message.
   *
   * <p>The write only applies while the stored body still equals {@code sourceBody}. A message
   * edited or deleted after its body was loaded is left untouched and stays pending.
   *
   * @return true if the embedding was stored
   */
  boolean updateEmbedding(
      long messageId, String sourceBody, String embedding, int embeddingVersion, long lastIndexed);

  long countMessages();

  long countEmbedded();
}
