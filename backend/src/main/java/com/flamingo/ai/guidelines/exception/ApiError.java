package com.flamingo.ai.guidelines.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INGESTION_FAILED = "INGEST_001";
  public static final String INVALID_SOURCE = "INGEST_002";
  public static final String STORAGE_UNAVAILABLE = "BACKEND_001";
  public static final String EMBEDDING_UNAVAILABLE = "BACKEND_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
