package com.flamingo.ai.messagesearch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String INVALID_SEARCH_REQUEST = "SEARCH_002";
  public static final String INDEXING_RUN_ACTIVE = "INDEXING_001";
  public static final String MESSAGE_NOT_FOUND = "MESSAGE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short ID that also appears in the server log line for this error. */
  private final String errorId;

  private final String code;

  private final String message;

  private final Instant timestamp;

  private final String path;
}
