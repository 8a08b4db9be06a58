package com.flamingo.ai.kbanalytics.exception;

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
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_NOT_FOUND)
                .message("Document not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(EmbeddingNotFoundException.class)
  public ResponseEntity<ApiError> handleEmbeddingNotFound(
      EmbeddingNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_not_found");
    String errorId = generateErrorId();
    log.warn("Embedding not found [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EMBEDDING_NOT_FOUND)
                .message("Document has not been embedded yet")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ClusteringJobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      ClusteringJobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("clustering_job_not_found");
    String errorId = generateErrorId();
    log.warn("Clustering job not found [{}]: {}", errorId, ex.getJobId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.JOB_NOT_FOUND)
                .message("Clustering job not found or expired")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ClusteringResultNotReadyException.class)
  public ResponseEntity<ApiError> handleResultNotReady(
      ClusteringResultNotReadyException ex, HttpServletRequest request) {

    incrementErrorCounter("clustering_result_not_ready");
    String errorId = generateErrorId();
    log.debug("Clustering result not ready [{}]: {} is {}", errorId, ex.getJobId(), ex.getStatus());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.JOB_RESULT_NOT_READY)
                .message(ex.getUserMessage())
                .details("status=" + ex.getStatus().wireName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(AnalyticsValidationException.class)
  public ResponseEntity<ApiError> handleAnalyticsValidation(
      AnalyticsValidationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Analytics validation error [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DimensionMismatchException.class)
  public ResponseEntity<ApiError> handleDimensionMismatch(
      DimensionMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("dimension_mismatch");
    String errorId = generateErrorId();
    log.error("Embedding dimension mismatch [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DIMENSION_MISMATCH)
                .message("Stored embeddings have inconsistent dimensions. Re-embed the corpus.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(EmptyInputException.class)
  public ResponseEntity<ApiError> handleEmptyInput(
      EmptyInputException ex, HttpServletRequest request) {

    incrementErrorCounter("empty_input");
    String errorId = generateErrorId();
    log.error("Empty numeric input [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EMPTY_INPUT)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<ApiError> handleExternalService(
      ExternalServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("external_service");
    String errorId = generateErrorId();
    log.error("External service error [{}] from {}: {}", errorId, ex.getService(), ex.getMessage());

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTERNAL_SERVICE_UNAVAILABLE)
                .message(ex.getUserMessage())
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

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for parameter '" + mismatch.getName() + "'"
            : "Malformed request body";

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
