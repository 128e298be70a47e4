package com.flamingo.ai.recall.index.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.TextAnalyzer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ElasticsearchMessageIndexTest {

  private static final long T1 = Instant.parse("2026-02-01T09:00:00Z").getEpochSecond();
  private static final long T2 = Instant.parse("2026-02-02T09:00:00Z").getEpochSecond();

  @Mock private ElasticsearchClient elasticsearchClient;

  private TextAnalyzer analyzer;
  private ElasticsearchMessageIndex index;

  @BeforeEach
  void setUp() {
    RecallConfig recallConfig = new RecallConfig();
    recallConfig.getSemantic().setDimensions(3);
    analyzer = new TextAnalyzer();
    index =
        new ElasticsearchMessageIndex(
            elasticsearchClient, recallConfig, analyzer, new SimpleMeterRegistry());
  }

  @AfterEach
  void tearDown() {
    analyzer.close();
  }

  private static Hit<MessageDocument> hit(String id, Double score, MessageDocument source) {
    return new Hit.Builder<MessageDocument>()
        .index("recall-messages-1")
        .id(id)
        .score(score)
        .source(source)
        .build();
  }

  private static MessageDocument document(String conversationId, long timestamp) {
    return MessageDocument.builder()
        .conversationId(conversationId)
        .role("user")
        .timestamp(timestamp)
        .build();
  }

  @SafeVarargs
  private void respondWith(Hit<MessageDocument>... hits) throws IOException {
    SearchResponse<MessageDocument> response =
        new SearchResponse.Builder<MessageDocument>()
            .took(1)
            .timedOut(false)
            .shards(s -> s.total(1).successful(1).failed(0))
            .hits(h -> h.hits(List.of(hits)))
            .build();
    when(elasticsearchClient.search(any(SearchRequest.class), eq(MessageDocument.class)))
        .thenReturn(response);
  }

  @Nested
  @DisplayName("keyword search")
  class KeywordSearch {

    @Test
    @DisplayName("should read typed documents back into hits ordered by score")
    void shouldMapTypedDocuments() throws IOException {
      respondWith(hit("m1", 1.5, document("c1", T1)), hit("m2", 3.0, document("c2", T2)));

      List<IndexHit> hits = index.search("sqlite pragmas", CandidateFilter.none(), 10);

      assertThat(hits).extracting(IndexHit::messageId).containsExactly("m2", "m1");
      assertThat(hits.get(0).conversationId()).isEqualTo("c2");
      assertThat(hits.get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(T2));
      assertThat(hits.get(0).score()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("should skip hits without a source or a score")
    void shouldSkipIncompleteHits() throws IOException {
      respondWith(
          hit("m1", 1.0, document("c1", T1)),
          hit("m2", null, document("c2", T2)),
          hit("m3", 2.0, null));

      assertThat(index.search("sqlite", CandidateFilter.none(), 10))
          .extracting(IndexHit::messageId)
          .containsExactly("m1");
    }

    @Test
    @DisplayName("should not query the cluster when only stop words remain")
    void shouldShortCircuitStopWords() throws IOException {
      assertThat(index.search("the and of", CandidateFilter.none(), 10)).isEmpty();

      verify(elasticsearchClient, never())
          .search(any(SearchRequest.class), eq(MessageDocument.class));
    }

    @Test
    @DisplayName("should report the index unavailable when the request fails")
    void shouldWrapTransportFailures() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(MessageDocument.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> index.search("sqlite", CandidateFilter.none(), 10))
          .isInstanceOf(IndexUnavailableException.class);
    }
  }

  @Nested
  @DisplayName("vector search")
  class VectorSearch {

    @Test
    @DisplayName("should map Elasticsearch cosine scores back to [-1, 1]")
    void shouldMapCosineScores() throws IOException {
      respondWith(hit("m1", 0.75, document("c1", T1)), hit("m2", 0.25, document("c2", T2)));

      List<IndexHit> hits = index.search(new float[] {1, 0, 0}, CandidateFilter.none(), 5);

      assertThat(hits).extracting(IndexHit::messageId).containsExactly("m1", "m2");
      assertThat(hits.get(0).score()).isCloseTo(0.5, within(1e-9));
      assertThat(hits.get(1).score()).isCloseTo(-0.5, within(1e-9));
    }

    @Test
    @DisplayName("should return nothing for a query vector of the wrong dimension")
    void shouldIgnoreMismatchedQuery() throws IOException {
      assertThat(index.search(new float[] {1, 0}, CandidateFilter.none(), 5)).isEmpty();

      verify(elasticsearchClient, never())
          .search(any(SearchRequest.class), eq(MessageDocument.class));
    }
  }
}
