package com.flamingo.ai.messagesearch.domain.repository;

import com.flamingo.ai.messagesearch.domain.entity.Message;
import com.flamingo.ai.messagesearch.service.store.EmbeddedMessageCandidate;
import com.flamingo.ai.messagesearch.service.store.PendingMessage;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Message entities. */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

  /** Loads every message body, used to rebuild corpus statistics. */
  @Query("SELECT m.body FROM Message m")
  List<String> findAllBodies();

  /** Finds ids of messages without an embedding or with one from another version. */
  @Query(
      "SELECT m.id FROM Message m WHERE m.embedding IS NULL OR m.embedding = '' "
          + "OR m.embeddingVersion IS NULL OR m.embeddingVersion <> :version "
          + "ORDER BY m.timestamp DESC, m.id DESC")
  List<Long> findIdsNeedingEmbedding(@Param("version") int version);

  /** Loads id and body for a batch of messages. */
  @Query(
      "SELECT new com.flamingo.ai.messagesearch.service.store.PendingMessage(m.id, m.body) "
          + "FROM Message m WHERE m.id IN :ids")
  List<PendingMessage> findPendingByIds(@Param("ids") Collection<Long> ids);

  /** Keyset page of embedded messages with ids greater than {@code afterId}. */
  @Query(
      "SELECT new com.flamingo.ai.messagesearch.service.store.EmbeddedMessageCandidate("
          + "m.id, m.threadId, m.sender, m.timestamp, m.body, m.embedding) "
          + "FROM Message m WHERE m.embedding IS NOT NULL AND m.embedding <> '' "
          + "AND m.id > :afterId ORDER BY m.id ASC")
  List<EmbeddedMessageCandidate> findEmbeddedAfter(
      @Param("afterId") long afterId, Pageable pageable);

  /**
   * Writes the embedding column group in one statement, only while the body still equals the text
   * the embedding was computed from.
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Message m SET m.embedding = :embedding, m.embeddingVersion = :version, "
          + "m.lastIndexed = :lastIndexed WHERE m.id = :id AND m.body = :body")
  int updateEmbedding(
      @Param("id") Long id,
      @Param("body") String body,
      @Param("embedding") String embedding,
      @Param("version") int version,
      @Param("lastIndexed") long lastIndexed);

  /** Clears the embedding column group so the message is picked up by the next run. */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Message m SET m.embedding = NULL, m.embeddingVersion = 0, m.lastIndexed = NULL "
          + "WHERE m.id = :id")
  int clearEmbedding(@Param("id") Long id);

  @Query("SELECT COUNT(m) FROM Message m WHERE m.embedding IS NOT NULL AND m.embedding <> ''")
  long countEmbedded();
}
