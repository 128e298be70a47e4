package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.index.IndexHit;
import java.util.List;

/** Result of one sub-index query: its status and the hits it contributed. */
public record SubQueryOutcome(SubQueryStatus status, List<IndexHit> hits) {

  public SubQueryOutcome {
    hits = List.copyOf(hits);
  }

  public static SubQueryOutcome ok(List<IndexHit> hits) {
    return new SubQueryOutcome(SubQueryStatus.OK, hits);
  }

  public static SubQueryOutcome empty(SubQueryStatus status) {
    return new SubQueryOutcome(status, List.of());
  }
}
