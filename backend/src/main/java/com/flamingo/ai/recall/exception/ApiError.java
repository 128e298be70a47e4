package com.flamingo.ai.recall.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MESSAGE_NOT_FOUND = "MESSAGE_001";
  public static final String CONVERSATION_NOT_FOUND = "CONVERSATION_001";
  public static final String DUPLICATE_MESSAGE = "CORPUS_001";
  public static final String BACKFILL_IN_PROGRESS = "INDEX_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as the offending parameter. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
