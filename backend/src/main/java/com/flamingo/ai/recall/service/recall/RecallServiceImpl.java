package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.enums.SearchMode;
import com.flamingo.ai.recall.search.CandidateGroup;
import com.flamingo.ai.recall.search.ConversationGrouper;
import com.flamingo.ai.recall.search.HybridOutcome;
import com.flamingo.ai.recall.search.HybridSearchService;
import com.flamingo.ai.recall.search.QueryDescriptor;
import com.flamingo.ai.recall.search.QueryPlan;
import com.flamingo.ai.recall.search.QueryPlanner;
import com.flamingo.ai.recall.search.ScoredCandidate;
import com.flamingo.ai.recall.search.SearchQuery;
import com.flamingo.ai.recall.search.SearchStatus;
import com.flamingo.ai.recall.service.corpus.ConversationDetail;
import com.flamingo.ai.recall.service.corpus.ConversationSummary;
import com.flamingo.ai.recall.service.corpus.CorpusService;
import com.flamingo.ai.recall.service.ledger.ActionHandle;
import com.flamingo.ai.recall.service.ledger.ActionLedgerService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Plans, runs and hydrates searches.
 *
 * <p>Queries with terms go through {@link HybridSearchService}; queries without terms are a
 * filtered scan of the corpus, newest first. Every search is recorded in the action ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallServiceImpl implements RecallService {

  static final String SEARCH_KIND = "search";
  static final String GROUPED_SEARCH_KIND = "search.grouped";

  private static final String ELLIPSIS = "…";

  private final QueryPlanner queryPlanner;
  private final HybridSearchService hybridSearchService;
  private final ConversationGrouper conversationGrouper;
  private final CorpusService corpusService;
  private final ActionLedgerService actionLedgerService;
  private final RecallConfig recallConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "recall.search", description = "Time to answer a flat search")
  public SearchResult search(SearchQuery query) {
    QueryPlan plan = queryPlanner.plan(query.toBuilder().group(false).build());
    ActionHandle handle = actionLedgerService.start(SEARCH_KIND, params(plan));
    long start = System.nanoTime();
    try {
      Retrieval retrieval = retrieve(plan);
      List<ScoredCandidate> top =
          retrieval.candidates().stream().limit(plan.descriptor().topK()).toList();
      List<SearchHit> hits = hydrate(top, retrieval.messages());

      SearchResult result =
          new SearchResult(
              plan.mode(),
              retrieval.status(),
              retrieval.warnings(),
              retrieval.counts(),
              elapsedSeconds(start),
              hits);
      log.info(
          "{} search returned {} hits in {}s (status {})",
          plan.mode(),
          hits.size(),
          result.seconds(),
          result.status());
      record(handle, retrieval, Map.of("hits", hits.size()));
      return result;
    } catch (RuntimeException e) {
      actionLedgerService.fail(handle, e);
      throw e;
    }
  }

  @Override
  @Timed(value = "recall.searchGrouped", description = "Time to answer a grouped search")
  public GroupedSearchResult searchGrouped(SearchQuery query) {
    QueryPlan plan = queryPlanner.plan(query.toBuilder().group(true).build());
    ActionHandle handle = actionLedgerService.start(GROUPED_SEARCH_KIND, params(plan));
    long start = System.nanoTime();
    try {
      Retrieval retrieval = retrieve(plan);
      QueryDescriptor descriptor = plan.descriptor();
      List<CandidateGroup> candidateGroups =
          conversationGrouper.group(
              retrieval.candidates(), descriptor.convos(), descriptor.perConvo());

      Map<String, ConversationSummary> summaries =
          corpusService.summarize(
              candidateGroups.stream().map(CandidateGroup::conversationId).toList());
      List<ConversationGroup> groups = new ArrayList<>(candidateGroups.size());
      int hitCount = 0;
      for (CandidateGroup candidateGroup : candidateGroups) {
        List<SearchHit> hits = hydrate(candidateGroup.candidates(), retrieval.messages());
        ConversationSummary summary = summaries.get(candidateGroup.conversationId());
        if (hits.isEmpty() || summary == null) {
          continue;
        }
        groups.add(new ConversationGroup(summary, candidateGroup.bestScore(), hits));
        hitCount += hits.size();
      }

      GroupedSearchResult result =
          new GroupedSearchResult(
              plan.mode(),
              retrieval.status(),
              retrieval.warnings(),
              retrieval.counts(),
              elapsedSeconds(start),
              groups);
      log.info(
          "{} grouped search returned {} conversations, {} hits in {}s (status {})",
          plan.mode(),
          groups.size(),
          hitCount,
          result.seconds(),
          result.status());
      record(handle, retrieval, Map.of("conversations", groups.size(), "hits", hitCount));
      return result;
    } catch (RuntimeException e) {
      actionLedgerService.fail(handle, e);
      throw e;
    }
  }

  @Override
  public Message getMessage(String messageId) {
    return corpusService.getMessage(messageId);
  }

  @Override
  public ConversationDetail getConversation(String conversationId) {
    return corpusService.getConversation(conversationId);
  }

  /** Ranked candidates of a plan plus whatever messages were already loaded for them. */
  private record Retrieval(
      List<ScoredCandidate> candidates,
      Map<String, Message> messages,
      SearchStatus status,
      List<String> warnings,
      SearchCounts counts) {}

  private Retrieval retrieve(QueryPlan plan) {
    meterRegistry.counter("search.requests", "mode", plan.mode().name()).increment();
    if (plan.mode() == SearchMode.BROWSE) {
      List<Message> rows = corpusService.browse(plan.descriptor().filter(), plan.fusionLimit());
      List<ScoredCandidate> candidates =
          rows.stream()
              .map(
                  row ->
                      ScoredCandidate.unscored(
                          row.getId(), row.getConversationId(), row.getTimestamp()))
              .toList();
      Map<String, Message> messages =
          rows.stream().collect(Collectors.toMap(Message::getId, Function.identity()));
      return new Retrieval(
          candidates,
          messages,
          SearchStatus.OK,
          List.of(),
          new SearchCounts(0, 0, candidates.size()));
    }

    HybridOutcome outcome = hybridSearchService.search(plan);
    return new Retrieval(
        outcome.candidates(),
        Map.of(),
        outcome.status(),
        outcome.warnings(),
        new SearchCounts(
            outcome.lexical().hits().size(),
            outcome.semantic().hits().size(),
            outcome.candidates().size()));
  }

  /**
   * Loads the messages behind {@code candidates}. A candidate whose message is gone from the
   * store is dropped.
   */
  private List<SearchHit> hydrate(List<ScoredCandidate> candidates, Map<String, Message> loaded) {
    Map<String, Message> messages = new HashMap<>(loaded);
    List<String> missing =
        candidates.stream()
            .map(ScoredCandidate::messageId)
            .filter(id -> !messages.containsKey(id))
            .toList();
    if (!missing.isEmpty()) {
      messages.putAll(corpusService.findMessages(missing));
    }

    int previewChars = recallConfig.getSearch().getPreviewChars();
    List<SearchHit> hits = new ArrayList<>(candidates.size());
    for (ScoredCandidate candidate : candidates) {
      Message message = messages.get(candidate.messageId());
      if (message == null) {
        log.warn("Message {} is indexed but missing from the store", candidate.messageId());
        continue;
      }
      List<String> signals = new ArrayList<>(2);
      if (candidate.lexicalScore().isPresent()) {
        signals.add("lexical");
      }
      if (candidate.semanticScore().isPresent()) {
        signals.add("semantic");
      }
      hits.add(
          new SearchHit(
              message.getId(),
              message.getConversationId(),
              message.getRole(),
              message.getProject(),
              message.getTimestamp(),
              preview(message.getText(), previewChars),
              candidate.lexicalScore().isPresent()
                  ? candidate.lexicalScore().getAsDouble()
                  : null,
              candidate.semanticScore().isPresent()
                  ? candidate.semanticScore().getAsDouble()
                  : null,
              candidate.fusedScore(),
              List.copyOf(signals)));
    }
    return hits;
  }

  /** Truncates {@code text} to {@code maxChars} characters plus an ellipsis. */
  static String preview(String text, int maxChars) {
    if (text == null || maxChars <= 0 || text.length() <= maxChars) {
      return text;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end) + ELLIPSIS;
  }

  private void record(ActionHandle handle, Retrieval retrieval, Map<String, Object> extraCounts) {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("lexical", retrieval.counts().lexical());
    extra.put("semantic", retrieval.counts().semantic());
    extra.put("merged", retrieval.counts().merged());
    extra.putAll(extraCounts);
    if (retrieval.status() == SearchStatus.OK) {
      actionLedgerService.ok(handle, extra);
    } else {
      actionLedgerService.warn(handle, extra, String.join("; ", retrieval.warnings()));
    }
  }

  private static Map<String, Object> params(QueryPlan plan) {
    QueryDescriptor descriptor = plan.descriptor();
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("mode", plan.mode().name());
    params.put("q", descriptor.terms());
    if (descriptor.project() != null) {
      params.put("project", descriptor.project());
    }
    if (descriptor.role() != null) {
      params.put("role", descriptor.role().wireName());
    }
    if (descriptor.since() != null) {
      params.put("since", descriptor.since().getEpochSecond());
    }
    if (descriptor.until() != null) {
      params.put("until", descriptor.until().getEpochSecond());
    }
    params.put("top", descriptor.topK());
    if (descriptor.group()) {
      params.put("convos", descriptor.convos());
      params.put("perConvo", descriptor.perConvo());
    }
    return params;
  }

  private static double elapsedSeconds(long startNanos) {
    return Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
  }
}
