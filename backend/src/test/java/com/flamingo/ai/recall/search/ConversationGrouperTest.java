package com.flamingo.ai.recall.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConversationGrouperTest {

  private final ConversationGrouper grouper = new ConversationGrouper();

  private static ScoredCandidate candidate(String id, String conversation, double score) {
    return new ScoredCandidate(
        id,
        conversation,
        Instant.parse("2026-01-01T00:00:00Z"),
        OptionalDouble.of(score),
        OptionalDouble.empty(),
        score);
  }

  private final List<ScoredCandidate> ranked =
      List.of(
          candidate("m1", "A", 0.9),
          candidate("m2", "B", 0.8),
          candidate("m3", "A", 0.7),
          candidate("m4", "C", 0.6),
          candidate("m5", "A", 0.5));

  @Test
  @DisplayName("should order conversations by their best candidate")
  void shouldOrderByBestCandidate() {
    List<CandidateGroup> groups = grouper.group(ranked, 10, 10);

    assertThat(groups).extracting(CandidateGroup::conversationId).containsExactly("A", "B", "C");
    assertThat(groups).extracting(CandidateGroup::bestScore).containsExactly(0.9, 0.8, 0.6);
    assertThat(groups.get(0).candidates())
        .extracting(ScoredCandidate::messageId)
        .containsExactly("m1", "m3", "m5");
  }

  @Test
  @DisplayName("should cap conversations and candidates per conversation")
  void shouldApplyBounds() {
    List<CandidateGroup> groups = grouper.group(ranked, 2, 2);

    assertThat(groups).hasSize(2);
    assertThat(groups.get(0).candidates())
        .extracting(ScoredCandidate::messageId)
        .containsExactly("m1", "m3");
    assertThat(groups.get(1).candidates())
        .extracting(ScoredCandidate::messageId)
        .containsExactly("m2");
  }

  @Test
  @DisplayName("should return nothing for a zero bound or empty input")
  void shouldReturnEmpty() {
    assertThat(grouper.group(ranked, 0, 5)).isEmpty();
    assertThat(grouper.group(ranked, 5, 0)).isEmpty();
    assertThat(grouper.group(List.of(), 5, 5)).isEmpty();
  }
}
