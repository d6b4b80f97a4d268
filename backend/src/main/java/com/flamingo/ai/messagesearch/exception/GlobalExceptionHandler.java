package com.flamingo.ai.messagesearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps service exceptions to {@link ApiError} responses and counts them. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MessageNotFoundException.class)
  public ResponseEntity<ApiError> handleMessageNotFound(
      MessageNotFoundException ex, HttpServletRequest request) {
    String errorId = record("message_not_found");
    log.warn("Message not found [{}]: {}", errorId, ex.getMessageId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MESSAGE_NOT_FOUND, "Message not found", request);
  }

  @ExceptionHandler(InvalidSearchRequestException.class)
  public ResponseEntity<ApiError> handleInvalidSearchRequest(
      InvalidSearchRequestException ex, HttpServletRequest request) {
    String errorId = record("invalid_search_request");
    log.warn("Invalid search request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_SEARCH_REQUEST,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(IndexingRunActiveException.class)
  public ResponseEntity<ApiError> handleIndexingRunActive(
      IndexingRunActiveException ex, HttpServletRequest request) {
    String errorId = record("indexing_run_active");
    log.info("Rejected indexing run [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.INDEXING_RUN_ACTIVE, ex.getMessage(), request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    String errorId = record("search_error");
    log.error(
        "Search error [{}] after message {}: {}",
        errorId,
        ex.getLastScannedId(),
        ex.getMessage(),
        ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request is missing a parameter or has a malformed one",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }

  private static ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }
}
