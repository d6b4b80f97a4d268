package com.flamingo.ai.messagesearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for storing a message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMessageRequest {

  @NotNull(message = "Thread ID is required")
  private Long threadId;

  @NotBlank(message = "Sender is required")
  @Size(max = 255, message = "Sender must be at most 255 characters")
  private String sender;

  @NotNull(message = "Body is required")
  private String body;

  /** Epoch milliseconds; defaults to the time of the request. */
  private Long timestamp;
}
