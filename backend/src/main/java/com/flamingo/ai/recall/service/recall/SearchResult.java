package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.domain.enums.SearchMode;
import com.flamingo.ai.recall.search.SearchStatus;
import java.util.List;

/** Ranked flat result of a search. */
public record SearchResult(
    SearchMode mode,
    SearchStatus status,
    List<String> warnings,
    SearchCounts counts,
    double seconds,
    List<SearchHit> hits) {}
