package com.flamingo.ai.messagesearch.service.store;

/** A message that still needs an embedding. */
public record PendingMessage(Long id, String body) {}
