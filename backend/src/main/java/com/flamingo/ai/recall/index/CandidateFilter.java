package com.flamingo.ai.recall.index;

import com.flamingo.ai.recall.domain.enums.MessageRole;
import java.time.Instant;
import java.util.Objects;

/**
 * Conjunctive filters applied to index candidates. A null field matches everything; time bounds
 * are inclusive.
 */
public record CandidateFilter(String project, MessageRole role, Instant since, Instant until) {

  private static final CandidateFilter NONE = new CandidateFilter(null, null, null, null);

  public static CandidateFilter none() {
    return NONE;
  }

  public boolean isEmpty() {
    return project == null && role == null && since == null && until == null;
  }

  public boolean matches(IndexedMessage message) {
    if (project != null && !Objects.equals(project, message.project())) {
      return false;
    }
    if (role != null && role != message.role()) {
      return false;
    }
    Instant timestamp = message.timestamp();
    if (since != null && timestamp.isBefore(since)) {
      return false;
    }
    return until == null || !timestamp.isAfter(until);
  }
}
