package com.flamingo.ai.recall.search;

import java.util.List;

/**
 * Fused candidates of a hybrid search together with what each sub-index contributed.
 *
 * @param candidates fused and ranked, at most the plan's fusion limit
 * @param lexical lexical sub-query outcome
 * @param semantic semantic sub-query outcome
 * @param status overall status
 * @param warnings human-readable reasons for a non-OK status
 */
public record HybridOutcome(
    List<ScoredCandidate> candidates,
    SubQueryOutcome lexical,
    SubQueryOutcome semantic,
    SearchStatus status,
    List<String> warnings) {}
