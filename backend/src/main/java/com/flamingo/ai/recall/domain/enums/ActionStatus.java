package com.flamingo.ai.recall.domain.enums;

/** Outcome of a recorded action. */
public enum ActionStatus {
  RUNNING,
  OK,

  /** Finished, but part of the work was skipped or degraded. */
  WARN,

  ERROR
}
