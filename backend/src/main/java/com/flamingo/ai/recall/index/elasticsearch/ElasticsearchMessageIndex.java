package com.flamingo.ai.recall.index.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.IndexStatus;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.index.LexicalIndex;
import com.flamingo.ai.recall.index.SemanticIndex;
import com.flamingo.ai.recall.index.TextAnalyzer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed lexical and semantic index over messages.
 *
 * <p>Readers always query an alias. A full rebuild fills a fresh {@code <alias>-<generation>}
 * index, refreshes it, then moves the alias in one {@code updateAliases} call and drops the
 * previous index. Generation indexes have one shard and automatic refresh disabled, so an append
 * becomes visible all at once on the explicit refresh that ends it.
 */
@Service
@ConditionalOnProperty(name = "recall.index.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchMessageIndex implements LexicalIndex, SemanticIndex {

  static final String NAME = "elasticsearch";
  private static final int BULK_BATCH_SIZE = 500;

  private final ElasticsearchClient elasticsearchClient;
  private final RecallConfig recallConfig;
  private final TextAnalyzer analyzer;
  private final MeterRegistry meterRegistry;

  private final AtomicLong generation = new AtomicLong();
  private final AtomicReference<Instant> publishedAt = new AtomicReference<>();

  public ElasticsearchMessageIndex(
      ElasticsearchClient elasticsearchClient,
      RecallConfig recallConfig,
      TextAnalyzer analyzer,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.recallConfig = recallConfig;
    this.analyzer = analyzer;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String name() {
    return NAME;
  }

  private String alias() {
    return recallConfig.getIndex().getElasticsearch().getAlias();
  }

  private int dimensions() {
    return recallConfig.getSemantic().getDimensions();
  }

  @Override
  @Timed(value = "elasticsearch.rebuild", description = "Time to build and publish a generation")
  public synchronized void rebuild(CorpusSnapshot snapshot) {
    long number = Math.max(generation.get(), currentGenerationNumber()) + 1;
    String target = alias() + "-" + number;
    try {
      createGenerationIndex(target);
      bulkIndex(target, snapshot);
      elasticsearchClient.indices().refresh(r -> r.index(target));

      Set<String> previous = currentIndices();
      elasticsearchClient
          .indices()
          .updateAliases(
              u -> {
                for (String old : previous) {
                  u.actions(a -> a.remove(r -> r.index(old).alias(alias())));
                }
                return u.actions(a -> a.add(ad -> ad.index(target).alias(alias())));
              });
      for (String old : previous) {
        elasticsearchClient.indices().delete(d -> d.index(old));
      }

      generation.set(number);
      publishedAt.set(Instant.now());
      meterRegistry.counter("index.generation.published", "index", NAME).increment();
      log.info(
          "Published Elasticsearch generation {} ({} documents) behind alias {}",
          target,
          snapshot.messages().size(),
          alias());
    } catch (IOException e) {
      log.error("Failed to build Elasticsearch generation {}: {}", target, e.getMessage(), e);
      deleteQuietly(target);
      throw new IndexUnavailableException(NAME, "Failed to build index generation", e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.append", description = "Time to append documents")
  public synchronized void append(CorpusSnapshot additions) {
    if (additions.isEmpty()) {
      return;
    }
    try {
      if (!aliasExists()) {
        throw new IndexUnavailableException(NAME, "Cannot append before the first build");
      }
      bulkIndex(alias(), additions);
      elasticsearchClient.indices().refresh(r -> r.index(alias()));
      publishedAt.set(Instant.now());
      meterRegistry.counter("index.generation.published", "index", NAME).increment();
      log.debug("Appended {} documents to {}", additions.messages().size(), alias());
    } catch (IOException e) {
      log.error("Failed to append to {}: {}", alias(), e.getMessage(), e);
      throw new IndexUnavailableException(NAME, "Failed to append documents", e);
    }
  }

  @Override
  public IndexStatus status() {
    try {
      if (!aliasExists()) {
        return IndexStatus.notBuilt(NAME);
      }
      long count = elasticsearchClient.count(c -> c.index(alias())).count();
      return new IndexStatus(
          NAME,
          true,
          Math.max(generation.get(), currentGenerationNumber()),
          (int) count,
          publishedAt.get());
    } catch (IOException | RuntimeException e) {
      log.warn("Could not read status of {}: {}", alias(), e.getMessage());
      return IndexStatus.notBuilt(NAME);
    }
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "lexicalSearchFallback")
  public List<IndexHit> search(String terms, CandidateFilter filter, int limit) {
    if (analyzer.analyze(terms).isEmpty() || limit <= 0) {
      return List.of();
    }
    List<Query> filters = buildFilters(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(alias())
                    .size(limit)
                    .source(src -> src.filter(f -> f.excludes("text", "embedding")))
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.must(m -> m.match(mt -> mt.field("text").query(terms)))
                                        .filter(filters))));
    List<IndexHit> hits = execute(request, false);
    meterRegistry.counter("elasticsearch.keyword_search").increment();
    return hits;
  }

  @SuppressWarnings("unused")
  private List<IndexHit> lexicalSearchFallback(
      String terms, CandidateFilter filter, int limit, Throwable t) {
    meterRegistry.counter("elasticsearch.keyword_search.fallback").increment();
    throw unavailable("Keyword search failed", t);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "semanticSearchFallback")
  public List<IndexHit> search(float[] queryVector, CandidateFilter filter, int limit) {
    if (queryVector == null || queryVector.length != dimensions()) {
      log.warn(
          "Query vector has {} dimensions, index expects {}; returning no semantic candidates",
          queryVector == null ? 0 : queryVector.length,
          dimensions());
      return List.of();
    }
    if (limit <= 0) {
      return List.of();
    }
    List<Float> vector = toList(queryVector);
    List<Query> filters = buildFilters(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(alias())
                    .size(limit)
                    .source(src -> src.filter(f -> f.excludes("text", "embedding")))
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(vector)
                                .k(limit)
                                .numCandidates(Math.max(limit * 2, 100))
                                .filter(filters)));
    List<IndexHit> hits = execute(request, true);
    meterRegistry.counter("elasticsearch.vector_search").increment();
    return hits;
  }

  @SuppressWarnings("unused")
  private List<IndexHit> semanticSearchFallback(
      float[] queryVector, CandidateFilter filter, int limit, Throwable t) {
    meterRegistry.counter("elasticsearch.vector_search.fallback").increment();
    throw unavailable("Vector search failed", t);
  }

  private IndexUnavailableException unavailable(String message, Throwable t) {
    if (t instanceof IndexUnavailableException e) {
      return e;
    }
    log.warn("{} on {}: {}", message, alias(), t.getMessage());
    return new IndexUnavailableException(NAME, message, t);
  }

  private List<IndexHit> execute(SearchRequest request, boolean cosine) {
    try {
      SearchResponse<MessageDocument> response =
          elasticsearchClient.search(request, MessageDocument.class);
      List<IndexHit> hits = new ArrayList<>();
      for (Hit<MessageDocument> hit : response.hits().hits()) {
        MessageDocument source = hit.source();
        if (source == null || source.getTimestamp() == null || hit.score() == null) {
          continue;
        }
        double score = hit.score();
        // Elasticsearch reports cosine similarity as (1 + cos) / 2.
        if (cosine) {
          score = 2 * score - 1;
        }
        hits.add(
            new IndexHit(
                hit.id(),
                source.getConversationId(),
                Instant.ofEpochSecond(source.getTimestamp()),
                score));
      }
      return hits.stream().sorted(IndexHit.RANKING).toList();
    } catch (IOException e) {
      throw new IndexUnavailableException(NAME, "Search request failed", e);
    }
  }

  private List<Query> buildFilters(CandidateFilter filter) {
    List<Query> filters = new ArrayList<>();
    if (filter.project() != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("project").value(filter.project()))));
    }
    if (filter.role() != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("role").value(filter.role().wireName()))));
    }
    if (filter.since() != null || filter.until() != null) {
      filters.add(
          Query.of(
              q ->
                  q.range(
                      r ->
                          r.number(
                              n -> {
                                n.field("timestamp");
                                if (filter.since() != null) {
                                  n.gte((double) filter.since().getEpochSecond());
                                }
                                if (filter.until() != null) {
                                  n.lte((double) filter.until().getEpochSecond());
                                }
                                return n;
                              }))));
    }
    return filters;
  }

  private void createGenerationIndex(String index) throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("conversationId", Property.of(p -> p.keyword(k -> k)));
    properties.put("role", Property.of(p -> p.keyword(k -> k)));
    properties.put("project", Property.of(p -> p.keyword(k -> k)));
    properties.put("timestamp", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "text", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer("recall_text")))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d -> d.dims(dimensions()).index(true).similarity(DenseVectorSimilarity.Cosine)))));

    elasticsearchClient
        .indices()
        .create(
            c ->
                c.index(index)
                    .settings(
                        s ->
                            s.numberOfShards("1")
                                .numberOfReplicas("0")
                                .refreshInterval(t -> t.time("-1"))
                                .analysis(
                                    a ->
                                        a.analyzer(
                                            "recall_text",
                                            an ->
                                                an.custom(
                                                    cu ->
                                                        cu.tokenizer("standard")
                                                            .filter("lowercase", "asciifolding")))))
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    log.info("Created Elasticsearch index {}", index);
  }

  private void bulkIndex(String index, CorpusSnapshot snapshot) throws IOException {
    List<IndexedMessage> messages = snapshot.messages();
    for (int start = 0; start < messages.size(); start += BULK_BATCH_SIZE) {
      List<IndexedMessage> batch =
          messages.subList(start, Math.min(start + BULK_BATCH_SIZE, messages.size()));
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (IndexedMessage message : batch) {
        MessageDocument doc = toDocument(message, snapshot.embeddings().get(message.id()));
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(index).id(message.id()).document(doc)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        long failed = response.items().stream().filter(item -> item.error() != null).count();
        log.warn("{} of {} documents failed to index in {}", failed, batch.size(), index);
        meterRegistry.counter("elasticsearch.index.errors").increment(failed);
      }
    }
  }

  private MessageDocument toDocument(IndexedMessage message, float[] embedding) {
    MessageDocument.MessageDocumentBuilder doc =
        MessageDocument.builder()
            .conversationId(message.conversationId())
            .role(message.role().wireName())
            .project(message.project())
            .timestamp(message.timestamp().getEpochSecond())
            .text(message.text());
    int minTextLength = recallConfig.getSemantic().getMinTextLength();
    if (embedding != null
        && embedding.length == dimensions()
        && (minTextLength <= 0 || message.text().length() >= minTextLength)
        && !isZero(embedding)) {
      doc.embedding(toList(embedding));
    }
    return doc.build();
  }

  private boolean aliasExists() throws IOException {
    return elasticsearchClient.indices().existsAlias(e -> e.name(alias())).value();
  }

  private Set<String> currentIndices() throws IOException {
    if (!aliasExists()) {
      return Set.of();
    }
    return elasticsearchClient.indices().getAlias(g -> g.name(alias())).aliases().keySet();
  }

  private long currentGenerationNumber() {
    try {
      long highest = 0;
      String prefix = alias() + "-";
      for (String index : currentIndices()) {
        if (index.startsWith(prefix)) {
          try {
            highest = Math.max(highest, Long.parseLong(index.substring(prefix.length())));
          } catch (NumberFormatException e) {
            log.debug("Ignoring index {} behind alias {}", index, alias());
          }
        }
      }
      return highest;
    } catch (IOException | RuntimeException e) {
      log.warn("Could not resolve alias {}: {}", alias(), e.getMessage());
      return 0;
    }
  }

  private void deleteQuietly(String index) {
    try {
      elasticsearchClient.indices().delete(d -> d.index(index).ignoreUnavailable(true));
    } catch (IOException | RuntimeException e) {
      log.warn("Could not delete partial index {}: {}", index, e.getMessage());
    }
  }

  private static boolean isZero(float[] vector) {
    for (float v : vector) {
      if (v != 0f) {
        return false;
      }
    }
    return true;
  }

  private static List<Float> toList(float[] vector) {
    List<Float> list = new ArrayList<>(vector.length);
    for (float v : vector) {
      list.add(v);
    }
    return list;
  }
}
