package com.flamingo.ai.recall.service.corpus;

import java.time.Instant;

/**
 * Stored and derived attributes of a conversation, for display and grouping only.
 *
 * @param spanStart earliest message timestamp
 * @param spanEnd latest message timestamp
 * @param project most frequent project among its messages, ties going to the earliest message
 */
public record ConversationSummary(
    String id,
    String title,
    String source,
    Instant createdAt,
    Instant spanStart,
    Instant spanEnd,
    int messageCount,
    String project) {}
