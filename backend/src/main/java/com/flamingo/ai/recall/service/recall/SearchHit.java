package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.domain.enums.MessageRole;
import java.time.Instant;
import java.util.List;

/**
 * A hydrated result message.
 *
 * @param preview message text truncated for display
 * @param lexicalScore raw BM25 score, null when the lexical index did not return the message
 * @param semanticScore raw cosine similarity, null when the semantic index did not return it
 * @param score fused score; 0 for browse results
 * @param signals names of the indexes that returned the message
 */
public record SearchHit(
    String messageId,
    String conversationId,
    MessageRole role,
    String project,
    Instant timestamp,
    String preview,
    Double lexicalScore,
    Double semanticScore,
    double score,
    List<String> signals) {}
