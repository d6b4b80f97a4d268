package com.flamingo.ai.messagesearch.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for replacing a message body. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMessageBodyRequest {

  @NotNull(message = "Body is required")
  private String body;
}
