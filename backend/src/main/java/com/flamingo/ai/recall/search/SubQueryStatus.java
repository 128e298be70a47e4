package com.flamingo.ai.recall.search;

/** How one sub-index query ended. */
public enum SubQueryStatus {
  OK,

  /** The deadline passed; the sub-index contributed nothing. */
  TIMED_OUT,

  /** The index is not built or its backend failed. */
  UNAVAILABLE,

  /** Unexpected failure. */
  ERROR,

  /** No query embedding could be produced, so the semantic index was not consulted. */
  EMBEDDING_UNAVAILABLE;

  /** Whether this outcome degrades the search. A missing query embedding does not. */
  public boolean isFailure() {
    return this == TIMED_OUT || this == UNAVAILABLE || this == ERROR;
  }
}
