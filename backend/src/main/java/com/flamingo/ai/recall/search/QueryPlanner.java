package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import com.flamingo.ai.recall.domain.enums.SearchMode;
import com.flamingo.ai.recall.exception.QueryValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates a raw search request and decides how to run it.
 *
 * <p>Non-blank terms give a {@link SearchMode#HYBRID} plan that consults both indexes. Blank
 * terms give a {@link SearchMode#BROWSE} plan: a filtered scan of the corpus, newest first.
 * Malformed input is rejected here and never reaches an index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryPlanner {

  private final RecallConfig recallConfig;

  /**
   * Builds the plan for {@code query}.
   *
   * @throws QueryValidationException if a filter is malformed or a limit is not positive
   */
  public QueryPlan plan(SearchQuery query) {
    RecallConfig.Search search = recallConfig.getSearch();

    String terms = query.terms() == null ? "" : query.terms().trim();
    String project =
        query.project() == null || query.project().isBlank() ? null : query.project().trim();
    MessageRole role = parseRole(query.role());

    Instant since = TimeBoundParser.parse("since", query.since());
    Instant until = TimeBoundParser.parse("until", query.until());
    if (since != null && until != null && since.isAfter(until)) {
      throw new QueryValidationException(
          "since", "since (" + since + ") must not be after until (" + until + ")");
    }
    // Stored timestamps have whole-second precision.
    since = ceilToSecond(since);
    until = until == null ? null : until.truncatedTo(ChronoUnit.SECONDS);

    int topK = limit("top", query.topK(), search.getDefaultTopK(), search.getMaxTopK());
    int convos = limit("convos", query.convos(), search.getDefaultConvos(), search.getMaxConvos());
    int perConvo =
        limit(
            "perConvo", query.perConvo(), search.getDefaultPerConvo(), search.getMaxPerConvo());

    QueryDescriptor descriptor =
        new QueryDescriptor(
            terms, project, role, since, until, topK, query.group(), convos, perConvo);

    int fusionLimit =
        query.group() ? Math.min(Math.max(topK, convos * perConvo), search.getMaxTopK()) : topK;
    SearchMode mode = descriptor.hasTerms() ? SearchMode.HYBRID : SearchMode.BROWSE;
    int fanOut =
        Math.min(
            Math.max(search.getMinFanOut(), fusionLimit * search.getOverFetchMultiplier()),
            search.getMaxFanOut());

    log.debug(
        "Planned {} query: topK={}, fusionLimit={}, fanOut={}, filter={}",
        mode,
        topK,
        fusionLimit,
        fanOut,
        descriptor.filter());
    return new QueryPlan(descriptor, mode, fanOut, fusionLimit);
  }

  private static Instant ceilToSecond(Instant instant) {
    if (instant == null || instant.getNano() == 0) {
      return instant;
    }
    return instant.plusSeconds(1).truncatedTo(ChronoUnit.SECONDS);
  }

  private static MessageRole parseRole(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return MessageRole.parse(raw)
        .orElseThrow(
            () ->
                new QueryValidationException(
                    "role",
                    "Unknown role '" + raw + "': expected user, assistant, system or other"));
  }

  private static int limit(String field, Integer requested, int defaultValue, int max) {
    if (requested == null) {
      return defaultValue;
    }
    if (requested <= 0) {
      throw new QueryValidationException(field, field + " must be positive, got " + requested);
    }
    return Math.min(requested, max);
  }
}
