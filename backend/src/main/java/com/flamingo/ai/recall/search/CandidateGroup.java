package com.flamingo.ai.recall.search;

import java.util.List;

/**
 * The candidates kept for one conversation.
 *
 * @param conversationId the conversation
 * @param bestScore fused score of its best candidate, the conversation's sort key
 * @param candidates kept candidates in fused order
 */
public record CandidateGroup(
    String conversationId, double bestScore, List<ScoredCandidate> candidates) {}
