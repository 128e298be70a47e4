package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.domain.enums.SearchMode;

/**
 * How one query will be executed.
 *
 * @param descriptor the validated request
 * @param mode hybrid search or browse scan
 * @param fanOut candidates requested from each sub-index
 * @param fusionLimit length of the fused list; larger than {@code topK} when grouping
 */
public record QueryPlan(QueryDescriptor descriptor, SearchMode mode, int fanOut, int fusionLimit) {}
