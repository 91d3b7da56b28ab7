package com.flamingo.ai.guidelines.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<ApiError> handleBackendUnavailable(
      BackendUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("backend_unavailable");
    String errorId = generateErrorId();
    log.error(
        "Backend unavailable [{}] backend={}: {}", errorId, ex.getBackend(), ex.getMessage(), ex);

    String code =
        BackendUnavailableException.EMBEDDING.equals(ex.getBackend())
            ? ApiError.EMBEDDING_UNAVAILABLE
            : ApiError.STORAGE_UNAVAILABLE;

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(error(errorId, code, ex.getUserMessage(), request));
  }

  @ExceptionHandler(IngestionException.class)
  public ResponseEntity<ApiError> handleIngestion(
      IngestionException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion_failed");
    String errorId = generateErrorId();
    log.error("Ingestion error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(error(errorId, ApiError.INGESTION_FAILED, ex.getUserMessage(), request));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_input");
    String errorId = generateErrorId();
    log.warn("Invalid input [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(error(errorId, ApiError.INVALID_SOURCE, ex.getMessage(), request));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(error(errorId, ApiError.VALIDATION_ERROR, message, request));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> handleMissingParameter(
      MissingServletRequestParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing parameter [{}]: {}", errorId, ex.getParameterName());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            error(
                errorId,
                ApiError.VALIDATION_ERROR,
                ex.getParameterName() + ": parameter is required",
                request));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            error(
                errorId,
                ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.",
                request));
  }

  private ApiError error(
      String errorId, String code, String message, HttpServletRequest request) {
    return ApiError.builder()
        .errorId(errorId)
        .code(code)
        .message(message)
        .path(request.getRequestURI())
        .timestamp(Instant.now())
        .build();
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
