package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.index.IndexHit;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.ToDoubleFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fuses lexical and semantic candidates into one ranked list.
 *
 * <p>Each signal is min-max normalized within the batch, so neither dominates because of its
 * raw scale. When every value of a signal is equal, including the single-candidate case, each
 * present value normalizes to 1.0. A missing signal contributes 0. The fused score is {@code
 * lexicalWeight * lex + semanticWeight * sem}, sorted by {@link ScoredCandidate#RANKING}.
 */
@Component
@Slf4j
public class RankFuser {

  private final double lexicalWeight;
  private final double semanticWeight;

  @Autowired
  public RankFuser(RecallConfig recallConfig) {
    this(
        recallConfig.getFusion().getLexicalWeight(), recallConfig.getFusion().getSemanticWeight());
  }

  public RankFuser(double lexicalWeight, double semanticWeight) {
    if (lexicalWeight < 0 || semanticWeight < 0) {
      throw new IllegalArgumentException(
          "Fusion weights must be non-negative: lexical="
              + lexicalWeight
              + ", semantic="
              + semanticWeight);
    }
    if (lexicalWeight == 0 && semanticWeight == 0) {
      throw new IllegalArgumentException("At least one fusion weight must be positive");
    }
    this.lexicalWeight = lexicalWeight;
    this.semanticWeight = semanticWeight;
  }

  private static final class Accumulator {
    private final String messageId;
    private final String conversationId;
    private final Instant timestamp;
    private OptionalDouble lexical = OptionalDouble.empty();
    private OptionalDouble semantic = OptionalDouble.empty();

    private Accumulator(IndexHit hit) {
      this.messageId = hit.messageId();
      this.conversationId = hit.conversationId();
      this.timestamp = hit.timestamp();
    }
  }

  /**
   * Fuses both candidate lists.
   *
   * @param lexical lexical hits, possibly empty
   * @param semantic semantic hits, possibly empty
   * @param limit maximum length of the result
   * @return fused candidates, best first; empty when both inputs are empty
   */
  public List<ScoredCandidate> fuse(List<IndexHit> lexical, List<IndexHit> semantic, int limit) {
    if ((lexical.isEmpty() && semantic.isEmpty()) || limit <= 0) {
      return List.of();
    }

    Map<String, Accumulator> union = new LinkedHashMap<>();
    for (IndexHit hit : lexical) {
      union.computeIfAbsent(hit.messageId(), id -> new Accumulator(hit)).lexical =
          OptionalDouble.of(hit.score());
    }
    for (IndexHit hit : semantic) {
      union.computeIfAbsent(hit.messageId(), id -> new Accumulator(hit)).semantic =
          OptionalDouble.of(hit.score());
    }

    Normalizer lexicalNorm = Normalizer.of(lexical, IndexHit::score);
    Normalizer semanticNorm = Normalizer.of(semantic, IndexHit::score);

    List<ScoredCandidate> fused =
        union.values().stream()
            .map(
                acc -> {
                  double score = 0;
                  if (acc.lexical.isPresent()) {
                    score += lexicalWeight * lexicalNorm.apply(acc.lexical.getAsDouble());
                  }
                  if (acc.semantic.isPresent()) {
                    score += semanticWeight * semanticNorm.apply(acc.semantic.getAsDouble());
                  }
                  return new ScoredCandidate(
                      acc.messageId,
                      acc.conversationId,
                      acc.timestamp,
                      acc.lexical,
                      acc.semantic,
                      score);
                })
            .sorted(ScoredCandidate.RANKING)
            .limit(limit)
            .toList();

    log.debug(
        "Fused {} lexical and {} semantic hits into {} of {} candidates",
        lexical.size(),
        semantic.size(),
        fused.size(),
        union.size());
    return fused;
  }

  /** Min-max scaling over one batch of raw scores. */
  private record Normalizer(double min, double max) {

    static Normalizer of(List<IndexHit> hits, ToDoubleFunction<IndexHit> score) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (IndexHit hit : hits) {
        double value = score.applyAsDouble(hit);
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
      return new Normalizer(min, max);
    }

    double apply(double value) {
      if (max <= min) {
        return 1.0;
      }
      return (value - min) / (max - min);
    }
  }
}
