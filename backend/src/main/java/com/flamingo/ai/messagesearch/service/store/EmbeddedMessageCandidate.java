package com.flamingo.ai.messagesearch.service.store;

/** Projection of an embedded message as read by the similarity scan. */
public record EmbeddedMessageCandidate(
    Long id, Long threadId, String sender, Long timestamp, String body, String embedding) {}
