package com.flamingo.ai.recall.service.recall;

/**
 * Candidate counts of one search.
 *
 * @param lexical hits returned by the lexical index
 * @param semantic hits returned by the semantic index
 * @param merged candidates after fusion, or rows scanned in browse mode
 */
public record SearchCounts(int lexical, int semantic, int merged) {}
