package com.flamingo.ai.recall.index;

import java.time.Instant;

/**
 * State of one index.
 *
 * @param name index name
 * @param ready whether a generation has been published
 * @param generation number of the published generation, 0 when none
 * @param documents documents visible in the published generation
 * @param publishedAt when the published generation was swapped in, null when none
 */
public record IndexStatus(
    String name, boolean ready, long generation, int documents, Instant publishedAt) {

  public static IndexStatus notBuilt(String name) {
    return new IndexStatus(name, false, 0, 0, null);
  }
}
