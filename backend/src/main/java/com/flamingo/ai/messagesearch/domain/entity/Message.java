package com.flamingo.ai.messagesearch.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A stored message together with its embedding columns.
 *
 * <p>{@code embedding}, {@code embeddingVersion} and {@code lastIndexed} are written together by a
 * single update statement: a message has an embedding exactly when {@code lastIndexed} is set.
 */
@Entity
@Table(
    name = "messages",
    indexes = {
      @Index(name = "idx_messages_thread_id", columnList = "threadId"),
      @Index(name = "idx_messages_timestamp", columnList = "timestamp"),
      @Index(name = "idx_messages_last_indexed", columnList = "lastIndexed")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private Long threadId;

  /** Address of the other party. */
  @Column(nullable = false)
  private String sender;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String body;

  /** Send or receive time in epoch milliseconds. */
  @Column(nullable = false)
  private Long timestamp;

  /** Serialized vector, see {@code EmbeddingGenerator#toStorageForm}. */
  @Column(columnDefinition = "TEXT")
  private String embedding;

  @Builder.Default private Integer embeddingVersion = 0;

  /** Epoch milliseconds of the last embedding write. */
  private Long lastIndexed;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
