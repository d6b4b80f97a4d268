package com.flamingo.ai.messagesearch.api.dto.response;

import com.flamingo.ai.messagesearch.domain.entity.Message;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for message data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

  private Long id;
  private Long threadId;
  private String sender;
  private String body;
  private Long timestamp;
  private boolean indexed;
  private Integer embeddingVersion;
  private Long lastIndexed;
  private LocalDateTime createdAt;

  /** Creates a MessageResponse from a Message entity. */
  public static MessageResponse fromEntity(Message message) {
    return MessageResponse.builder()
        .id(message.getId())
        .threadId(message.getThreadId())
        .sender(message.getSender())
        .body(message.getBody())
        .timestamp(message.getTimestamp())
        .indexed(message.hasEmbedding())
        .embeddingVersion(message.getEmbeddingVersion())
        .lastIndexed(message.getLastIndexed())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
