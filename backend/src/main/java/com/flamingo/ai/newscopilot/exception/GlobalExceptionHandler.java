package com.flamingo.ai.newscopilot.exception;

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
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  static final String RUN_CORE_ANALYSIS = "RUN_CORE_ANALYSIS";

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(UnknownAnalysisKindException.class)
  public ResponseEntity<ApiError> handleUnknownKind(
      UnknownAnalysisKindException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_kind");
    String errorId = generateErrorId();
    log.warn("Unknown analysis kind [{}]: {}", errorId, ex.getKind());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.UNKNOWN_ANALYSIS_KIND)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ContextMissingException.class)
  public ResponseEntity<ApiError> handleContextMissing(
      ContextMissingException ex, HttpServletRequest request) {

    incrementErrorCounter("context_missing");
    String errorId = generateErrorId();
    log.warn("Context missing [{}]: session={}", errorId, ex.getSessionKey());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.CONTEXT_MISSING)
                .message(ex.getUserMessage())
                .action(RUN_CORE_ANALYSIS)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DeadlineExceededException.class)
  public ResponseEntity<ApiError> handleDeadline(
      DeadlineExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("deadline_exceeded");
    String errorId = generateErrorId();
    log.error("Analysis deadline exceeded [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DEADLINE_EXCEEDED)
                .message("The analysis took too long. Please try again.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler({LlmServiceException.class, TransientProviderException.class})
  public ResponseEntity<ApiError> handleLlmService(
      RuntimeException ex, HttpServletRequest request) {

    boolean transientFailure = ex instanceof TransientProviderException;
    incrementErrorCounter(transientFailure ? "llm_unavailable" : "llm_error");
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String message =
        ex instanceof LlmServiceException llm
            ? llm.getUserMessage()
            : "AI service is temporarily unavailable. Please try again later.";

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(transientFailure ? ApiError.LLM_UNAVAILABLE : ApiError.LLM_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    Throwable cause = ex.getMostSpecificCause();
    if (cause instanceof UnknownAnalysisKindException unknown) {
      return handleUnknownKind(unknown, request);
    }
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, cause.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message("Malformed request body")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
