package com.flamingo.ai.recall.search;

import java.time.Instant;
import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * A fused result. Each signal is present only when its index returned the message.
 *
 * @param messageId message id
 * @param conversationId owning conversation
 * @param timestamp message timestamp, used to break score ties
 * @param lexicalScore raw BM25 score
 * @param semanticScore raw cosine similarity in [-1, 1]
 * @param fusedScore weighted sum of the normalized signals
 */
public record ScoredCandidate(
    String messageId,
    String conversationId,
    Instant timestamp,
    OptionalDouble lexicalScore,
    OptionalDouble semanticScore,
    double fusedScore) {

  /** Fused score descending, then more recent first, then id ascending. */
  public static final Comparator<ScoredCandidate> RANKING =
      Comparator.comparingDouble(ScoredCandidate::fusedScore)
          .reversed()
          .thenComparing(ScoredCandidate::timestamp, Comparator.reverseOrder())
          .thenComparing(ScoredCandidate::messageId);

  /** A browse result: no signal, ranked by recency alone. */
  public static ScoredCandidate unscored(
      String messageId, String conversationId, Instant timestamp) {
    return new ScoredCandidate(
        messageId, conversationId, timestamp, OptionalDouble.empty(), OptionalDouble.empty(), 0);
  }
}
