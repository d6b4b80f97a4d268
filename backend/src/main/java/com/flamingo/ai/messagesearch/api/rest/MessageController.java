package com.flamingo.ai.messagesearch.api.rest;

import com.flamingo.ai.messagesearch.api.dto.request.CreateMessageRequest;
import com.flamingo.ai.messagesearch.api.dto.request.UpdateMessageBodyRequest;
import com.flamingo.ai.messagesearch.api.dto.response.MessageResponse;
import com.flamingo.ai.messagesearch.domain.entity.Message;
import com.flamingo.ai.messagesearch.service.message.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for storing and reading messages. */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

  private final MessageService messageService;

  /** Stores a message. It becomes searchable after the next indexing run. */
  @PostMapping
  public ResponseEntity<MessageResponse> createMessage(
      @Valid @RequestBody CreateMessageRequest request) {
    Message message =
        messageService.createMessage(
            request.getThreadId(), request.getSender(), request.getBody(), request.getTimestamp());
    return ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.fromEntity(message));
  }

  /** Gets a message by ID. */
  @GetMapping("/{messageId}")
  public ResponseEntity<MessageResponse> getMessage(@PathVariable Long messageId) {
    return ResponseEntity.ok(MessageResponse.fromEntity(messageService.getMessage(messageId)));
  }

  /** Replaces a message body; the message is re-embedded by the next indexing run. */
  @PutMapping("/{messageId}/body")
  public ResponseEntity<MessageResponse> updateBody(
      @PathVariable Long messageId, @Valid @RequestBody UpdateMessageBodyRequest request) {
    Message message = messageService.updateBody(messageId, request.getBody());
    return ResponseEntity.ok(MessageResponse.fromEntity(message));
  }
}
