package com.flamingo.ai.recall.search;

import lombok.Builder;

/**
 * A search request as received, before validation. Every field is optional; absent values take
 * the configured defaults.
 */
@Builder(toBuilder = true)
public record SearchQuery(
    String terms,
    String project,
    String role,
    String since,
    String until,
    Integer topK,
    boolean group,
    Integer convos,
    Integer perConvo) {}
