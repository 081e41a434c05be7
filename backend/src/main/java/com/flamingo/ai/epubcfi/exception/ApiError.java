package com.flamingo.ai.epubcfi.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String MALFORMED_CFI = "CFI_001";
  public static final String RESOLUTION_FAILED = "CFI_002";
  public static final String LINK_NOT_FOUND = "CFI_003";
  public static final String DOCUMENT_FETCH_FAILED = "CFI_004";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as the parser's diagnosis. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
