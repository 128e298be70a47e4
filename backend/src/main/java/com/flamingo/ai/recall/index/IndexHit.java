package com.flamingo.ai.recall.index;

import java.time.Instant;
import java.util.Comparator;

/** One candidate returned by a sub-index, with its raw score on that index's scale. */
public record IndexHit(String messageId, String conversationId, Instant timestamp, double score) {

  /** Score descending, then more recent first, then id ascending. */
  public static final Comparator<IndexHit> RANKING =
      Comparator.comparingDouble(IndexHit::score)
          .reversed()
          .thenComparing(IndexHit::timestamp, Comparator.reverseOrder())
          .thenComparing(IndexHit::messageId);

  public static IndexHit of(IndexedMessage message, double score) {
    return new IndexHit(message.id(), message.conversationId(), message.timestamp(), score);
  }
}
