package com.flamingo.ai.recall.index.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.IndexedMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemorySemanticIndexTest {

  private static final Instant T0 = Instant.parse("2026-01-05T08:00:00Z");

  private RecallConfig recallConfig;
  private InMemorySemanticIndex index;

  private final IndexedMessage east = message("m1", "alpha", "pointing east");
  private final IndexedMessage north = message("m2", "beta", "pointing north");
  private final IndexedMessage diagonal = message("m3", "alpha", "north east");
  private final IndexedMessage truncated = message("m4", "alpha", "wrong dimension");
  private final IndexedMessage zero = message("m5", "alpha", "zero vector");

  private static IndexedMessage message(String id, String project, String text) {
    return new IndexedMessage(id, "c-" + id, MessageRole.ASSISTANT, project, T0, text);
  }

  @BeforeEach
  void setUp() {
    recallConfig = new RecallConfig();
    recallConfig.getSemantic().setDimensions(3);
    index = new InMemorySemanticIndex(recallConfig, new SimpleMeterRegistry());
  }

  private void buildDefault() {
    index.rebuild(
        new CorpusSnapshot(
            List.of(east, north, diagonal, truncated, zero),
            Map.of(
                "m1", new float[] {2, 0, 0},
                "m2", new float[] {0, 1, 0},
                "m3", new float[] {1, 1, 0},
                "m4", new float[] {1, 0},
                "m5", new float[] {0, 0, 0})));
  }

  @Test
  @DisplayName("should be unavailable until the first build")
  void shouldBeUnavailableBeforeBuild() {
    assertThatThrownBy(() -> index.search(new float[] {1, 0, 0}, CandidateFilter.none(), 5))
        .isInstanceOf(IndexUnavailableException.class);
  }

  @Test
  @DisplayName("should exclude wrong-dimension and zero vectors from candidacy")
  void shouldExcludeUnusableVectors() {
    buildDefault();

    assertThat(index.status().documents()).isEqualTo(3);
    assertThat(index.search(new float[] {1, 0, 0}, CandidateFilter.none(), 10))
        .extracting(IndexHit::messageId)
        .doesNotContain("m4", "m5");
  }

  @Test
  @DisplayName("should rank by cosine similarity")
  void shouldRankByCosine() {
    buildDefault();

    List<IndexHit> hits = index.search(new float[] {5, 0, 0}, CandidateFilter.none(), 2);

    assertThat(hits).extracting(IndexHit::messageId).containsExactly("m1", "m3");
    assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-5));
    assertThat(hits.get(1).score()).isCloseTo(Math.sqrt(0.5), within(1e-5));
  }

  @Test
  @DisplayName("should apply filters")
  void shouldApplyFilters() {
    buildDefault();

    assertThat(
            index.search(
                new float[] {1, 0, 0}, new CandidateFilter("beta", null, null, null), 10))
        .extracting(IndexHit::messageId)
        .containsExactly("m2");
  }

  @Test
  @DisplayName("should return nothing for a query vector of the wrong dimension")
  void shouldIgnoreMismatchedQuery() {
    buildDefault();

    assertThat(index.search(new float[] {1, 0}, CandidateFilter.none(), 10)).isEmpty();
  }

  @Test
  @DisplayName("should keep short messages out when a minimum length is configured")
  void shouldApplyMinimumTextLength() {
    recallConfig.getSemantic().setMinTextLength(13);
    buildDefault();

    assertThat(index.search(new float[] {1, 0, 0}, CandidateFilter.none(), 10))
        .extracting(IndexHit::messageId)
        .containsExactlyInAnyOrder("m1", "m2");
  }

  @Test
  @DisplayName("should add appended vectors and skip appends without embeddings")
  void shouldAppend() {
    buildDefault();
    IndexedMessage west = message("m6", "alpha", "pointing west");

    index.append(new CorpusSnapshot(List.of(west), Map.of()));
    assertThat(index.status().generation()).isEqualTo(1);

    index.append(new CorpusSnapshot(List.of(west), Map.of("m6", new float[] {-1, 0, 0})));
    assertThat(index.status().generation()).isEqualTo(2);
    assertThat(index.status().documents()).isEqualTo(4);
    assertThat(index.search(new float[] {-1, 0, 0}, CandidateFilter.none(), 1))
        .extracting(IndexHit::messageId)
        .containsExactly("m6");
  }

  @Test
  @DisplayName("should return nothing for a zero query vector")
  void shouldIgnoreZeroQuery() {
    buildDefault();

    assertThat(index.search(new float[] {0, 0, 0}, CandidateFilter.none(), 10)).isEmpty();
  }

  @Test
  @DisplayName("should report opposite vectors as negative similarity")
  void shouldMapScoresBackToCosine() {
    buildDefault();

    List<IndexHit> hits = index.search(new float[] {-1, 0, 0}, CandidateFilter.none(), 3);

    assertThat(hits).extracting(IndexHit::messageId).containsExactly("m2", "m3", "m1");
    assertThat(hits.get(0).score()).isCloseTo(0.0, within(1e-5));
    assertThat(hits.get(2).score()).isCloseTo(-1.0, within(1e-5));
  }

  @Test
  @DisplayName("should exclude messages outside the time bounds")
  void shouldApplyTimeBounds() {
    buildDefault();
    CandidateFilter afterT0 = new CandidateFilter(null, null, T0.plusMillis(1), null);

    assertThat(index.search(new float[] {1, 0, 0}, afterT0, 10)).isEmpty();
  }
}
