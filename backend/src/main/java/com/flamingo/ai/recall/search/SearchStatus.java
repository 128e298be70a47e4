package com.flamingo.ai.recall.search;

/** Overall health of one search. */
public enum SearchStatus {
  /** Every consulted index answered. Zero hits under this status means no matches. */
  OK,

  /** One index failed; results come from the other signal alone. */
  DEGRADED,

  /** Neither index could answer; an empty result says nothing about matches. */
  UNAVAILABLE
}
