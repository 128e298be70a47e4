package com.flamingo.ai.recall.domain.enums;

/** How a query is executed. */
public enum SearchMode {
  /** Non-blank terms: both indexes are consulted and their candidates fused. */
  HYBRID,

  /** Blank terms: filtered scan of the corpus, most recent first. */
  BROWSE
}
