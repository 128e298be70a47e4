package com.flamingo.ai.recall.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.recall.index.IndexHit;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RankFuserTest {

  private static final Instant T0 = Instant.parse("2026-01-10T12:00:00Z");

  private final RankFuser fuser = new RankFuser(0.5, 0.5);

  private static IndexHit hit(String id, double score) {
    return new IndexHit(id, "conv-" + id, T0, score);
  }

  @Nested
  @DisplayName("fuse")
  class Fuse {

    @Test
    @DisplayName("should min-max normalize each signal and sum the weighted values")
    void shouldNormalizeAndSum() {
      List<ScoredCandidate> fused =
          fuser.fuse(
              List.of(hit("a", 10), hit("b", 5), hit("c", 0)),
              List.of(hit("b", 0.9), hit("d", 0.5)),
              10);

      assertThat(fused).extracting(ScoredCandidate::messageId).containsExactly("b", "a", "c", "d");
      assertThat(fused.get(0).fusedScore()).isCloseTo(0.75, within(1e-9));
      assertThat(fused.get(1).fusedScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("should keep each raw signal only when its index returned the message")
    void shouldKeepOptionalSignals() {
      List<ScoredCandidate> fused =
          fuser.fuse(List.of(hit("a", 3)), List.of(hit("b", 0.4)), 10);

      ScoredCandidate a =
          fused.stream().filter(c -> c.messageId().equals("a")).findFirst().orElseThrow();
      ScoredCandidate b =
          fused.stream().filter(c -> c.messageId().equals("b")).findFirst().orElseThrow();
      assertThat(a.lexicalScore()).hasValue(3.0);
      assertThat(a.semanticScore()).isEmpty();
      assertThat(b.lexicalScore()).isEmpty();
      assertThat(b.semanticScore()).hasValue(0.4);
    }

    @Test
    @DisplayName("should never rank a message lower for being found by both indexes")
    void shouldNotPenalizeAgreement() {
      List<ScoredCandidate> lexicalOnly =
          fuser.fuse(List.of(hit("a", 2), hit("b", 1)), List.of(), 10);
      List<ScoredCandidate> both =
          fuser.fuse(List.of(hit("a", 2), hit("b", 1)), List.of(hit("b", 0.2)), 10);

      double bAlone =
          lexicalOnly.stream()
              .filter(c -> c.messageId().equals("b"))
              .findFirst()
              .orElseThrow()
              .fusedScore();
      double bBoth =
          both.stream()
              .filter(c -> c.messageId().equals("b"))
              .findFirst()
              .orElseThrow()
              .fusedScore();
      assertThat(bBoth).isGreaterThanOrEqualTo(bAlone);
    }

    @Test
    @DisplayName("should normalize a single value to one")
    void shouldNormalizeSingleValueToOne() {
      List<ScoredCandidate> fused = fuser.fuse(List.of(hit("a", 7.3)), List.of(), 10);

      assertThat(fused).singleElement().extracting(ScoredCandidate::fusedScore).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should break score ties by recency then id")
    void shouldBreakTies() {
      IndexHit older = new IndexHit("a", "c1", T0.minusSeconds(60), 1);
      IndexHit newer = new IndexHit("z", "c2", T0, 1);
      IndexHit sameTime = new IndexHit("m", "c3", T0, 1);

      List<ScoredCandidate> fused = fuser.fuse(List.of(older, newer, sameTime), List.of(), 10);

      assertThat(fused).extracting(ScoredCandidate::messageId).containsExactly("m", "z", "a");
    }

    @Test
    @DisplayName("should truncate to the limit and return nothing for empty input")
    void shouldTruncate() {
      assertThat(fuser.fuse(List.of(hit("a", 3), hit("b", 2), hit("c", 1)), List.of(), 2))
          .extracting(ScoredCandidate::messageId)
          .containsExactly("a", "b");
      assertThat(fuser.fuse(List.of(), List.of(), 10)).isEmpty();
    }
  }

  @Test
  @DisplayName("should reject negative or all-zero weights")
  void shouldRejectInvalidWeights() {
    assertThatThrownBy(() -> new RankFuser(-0.1, 1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RankFuser(0, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
