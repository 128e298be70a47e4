package com.flamingo.ai.recall.exception;

/** Exception thrown when a search request is malformed. Never reaches the indexes. */
public class QueryValidationException extends RuntimeException {

  private final String field;

  public QueryValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  /** Name of the offending request parameter. */
  public String getField() {
    return field;
  }
}
