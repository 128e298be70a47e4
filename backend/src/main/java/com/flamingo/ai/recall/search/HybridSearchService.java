package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.LexicalIndex;
import com.flamingo.ai.recall.index.SemanticIndex;
import com.flamingo.ai.recall.service.embedding.EmbeddingProducer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the lexical and semantic sub-queries of a hybrid plan side by side and fuses their hits.
 *
 * <p>Each sub-query has its own deadline. A sub-query that fails or runs late contributes an
 * empty list; it is never cancelled and its late result is discarded. No lock is held across
 * the join. If the query embedding cannot be produced the search continues on the lexical signal
 * alone and the status stays {@link SearchStatus#OK}.
 */
@Service
@Slf4j
public class HybridSearchService {

  private final LexicalIndex lexicalIndex;
  private final SemanticIndex semanticIndex;
  private final EmbeddingProducer embeddingProducer;
  private final RankFuser rankFuser;
  private final RecallConfig recallConfig;
  private final MeterRegistry meterRegistry;
  private final Executor searchExecutor;

  public HybridSearchService(
      LexicalIndex lexicalIndex,
      SemanticIndex semanticIndex,
      EmbeddingProducer embeddingProducer,
      RankFuser rankFuser,
      RecallConfig recallConfig,
      MeterRegistry meterRegistry,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.lexicalIndex = lexicalIndex;
    this.semanticIndex = semanticIndex;
    this.embeddingProducer = embeddingProducer;
    this.rankFuser = rankFuser;
    this.recallConfig = recallConfig;
    this.meterRegistry = meterRegistry;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Executes a hybrid plan.
   *
   * @param plan a plan whose descriptor has non-blank terms
   * @return fused candidates with per-index outcomes
   */
  @Timed(value = "search.hybrid", description = "Time for a hybrid search")
  public HybridOutcome search(QueryPlan plan) {
    QueryDescriptor descriptor = plan.descriptor();
    CandidateFilter filter = descriptor.filter();
    RecallConfig.Search config = recallConfig.getSearch();

    CompletableFuture<SubQueryOutcome> lexical =
        dispatch(
            "lexical",
            () ->
                SubQueryOutcome.ok(lexicalIndex.search(descriptor.terms(), filter, plan.fanOut())),
            config.getLexicalTimeout().toMillis(),
            null);

    AtomicBoolean embedded = new AtomicBoolean();
    CompletableFuture<SubQueryOutcome> semantic =
        dispatch(
            "semantic",
            () -> {
              float[] queryVector = embeddingProducer.embedQuery(descriptor.terms());
              if (queryVector.length == 0) {
                return SubQueryOutcome.empty(SubQueryStatus.EMBEDDING_UNAVAILABLE);
              }
              embedded.set(true);
              return SubQueryOutcome.ok(semanticIndex.search(queryVector, filter, plan.fanOut()));
            },
            config.getSemanticTimeout().toMillis(),
            embedded);

    SubQueryOutcome lexicalOutcome = lexical.join();
    SubQueryOutcome semanticOutcome = semantic.join();
    log.debug(
        "Sub-queries finished: lexical={} ({} hits), semantic={} ({} hits)",
        lexicalOutcome.status(),
        lexicalOutcome.hits().size(),
        semanticOutcome.status(),
        semanticOutcome.hits().size());

    List<ScoredCandidate> fused =
        rankFuser.fuse(lexicalOutcome.hits(), semanticOutcome.hits(), plan.fusionLimit());

    List<String> warnings = new ArrayList<>();
    SearchStatus status = status(lexicalOutcome, semanticOutcome, warnings);
    if (status != SearchStatus.OK) {
      meterRegistry.counter("search.degraded", "status", status.name()).increment();
      log.warn("Search {}: {}", status, warnings);
    }
    return new HybridOutcome(fused, lexicalOutcome, semanticOutcome, status, List.copyOf(warnings));
  }

  /**
   * Starts one sub-query on the search executor with a deadline.
   *
   * @param embedded for the semantic sub-query, set once the query embedding exists; a deadline
   *     that passes before then counts as a missing embedding rather than a timeout
   */
  private CompletableFuture<SubQueryOutcome> dispatch(
      String index, Supplier<SubQueryOutcome> task, long timeoutMillis, AtomicBoolean embedded) {
    CompletableFuture<SubQueryOutcome> future;
    try {
      future = CompletableFuture.supplyAsync(task, searchExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Search executor rejected the {} sub-query: {}", index, e.getMessage());
      return CompletableFuture.completedFuture(SubQueryOutcome.empty(SubQueryStatus.ERROR));
    }
    return future
        .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
        .exceptionally(ex -> classify(index, unwrap(ex), embedded));
  }

  private SubQueryOutcome classify(String index, Throwable cause, AtomicBoolean embedded) {
    if (cause instanceof TimeoutException) {
      if (embedded != null && !embedded.get()) {
        log.debug("Query embedding did not arrive before the {} deadline", index);
        return SubQueryOutcome.empty(SubQueryStatus.EMBEDDING_UNAVAILABLE);
      }
      log.warn("{} sub-query exceeded its deadline", index);
      meterRegistry.counter("search.subquery.timeout", "index", index).increment();
      return SubQueryOutcome.empty(SubQueryStatus.TIMED_OUT);
    }
    if (cause instanceof IndexUnavailableException) {
      log.warn("{} index unavailable: {}", index, cause.getMessage());
      return SubQueryOutcome.empty(SubQueryStatus.UNAVAILABLE);
    }
    log.error("{} sub-query failed: {}", index, cause.getMessage(), cause);
    meterRegistry.counter("search.subquery.error", "index", index).increment();
    return SubQueryOutcome.empty(SubQueryStatus.ERROR);
  }

  private static Throwable unwrap(Throwable ex) {
    if (ex instanceof CompletionException && ex.getCause() != null) {
      return ex.getCause();
    }
    return ex;
  }

  private static SearchStatus status(
      SubQueryOutcome lexical, SubQueryOutcome semantic, List<String> warnings) {
    boolean lexicalFailed = lexical.status().isFailure();
    boolean semanticFailed = semantic.status().isFailure();
    if (lexicalFailed && semanticFailed) {
      warnings.add(
          "Both indexes are unavailable (lexical: "
              + describe(lexical.status())
              + ", semantic: "
              + describe(semantic.status())
              + "); the empty result does not mean there are no matches");
      return SearchStatus.UNAVAILABLE;
    }
    if (lexicalFailed) {
      warnings.add(
          "Lexical index " + describe(lexical.status()) + "; ranked on semantic similarity only");
      return SearchStatus.DEGRADED;
    }
    if (semanticFailed) {
      warnings.add(
          "Semantic index " + describe(semantic.status()) + "; ranked on lexical relevance only");
      return SearchStatus.DEGRADED;
    }
    return SearchStatus.OK;
  }

  private static String describe(SubQueryStatus status) {
    return switch (status) {
      case TIMED_OUT -> "timed out";
      case UNAVAILABLE -> "unavailable";
      default -> "failed";
    };
  }
}
