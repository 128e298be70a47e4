package com.flamingo.ai.recall.exception;

/**
 * Exception thrown when an index cannot serve a query, because it has not been built yet or its
 * backend failed.
 *
 * <p>Absorbed per sub-query by the hybrid search; never mapped to an HTTP error.
 */
public class IndexUnavailableException extends RuntimeException {

  private final String indexName;

  public IndexUnavailableException(String indexName, String message) {
    super(message);
    this.indexName = indexName;
  }

  public IndexUnavailableException(String indexName, String message, Throwable cause) {
    super(message, cause);
    this.indexName = indexName;
  }

  public String getIndexName() {
    return indexName;
  }
}
