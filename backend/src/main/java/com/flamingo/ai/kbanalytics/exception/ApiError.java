package com.flamingo.ai.kbanalytics.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String EMBEDDING_NOT_FOUND = "EMBEDDING_001";
  public static final String JOB_NOT_FOUND = "CLUSTERING_001";
  public static final String JOB_RESULT_NOT_READY = "CLUSTERING_002";
  public static final String DIMENSION_MISMATCH = "VECTOR_001";
  public static final String EMPTY_INPUT = "VECTOR_002";
  public static final String EXTERNAL_SERVICE_UNAVAILABLE = "EXTERNAL_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, omitted unless useful to the caller. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
