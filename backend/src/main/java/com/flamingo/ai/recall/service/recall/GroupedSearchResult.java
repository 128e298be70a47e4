package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.domain.enums.SearchMode;
import com.flamingo.ai.recall.search.SearchStatus;
import java.util.List;

/** Result of a search bucketed by conversation, best conversation first. */
public record GroupedSearchResult(
    SearchMode mode,
    SearchStatus status,
    List<String> warnings,
    SearchCounts counts,
    double seconds,
    List<ConversationGroup> groups) {}
