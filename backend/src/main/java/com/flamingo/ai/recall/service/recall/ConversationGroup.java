package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.service.corpus.ConversationSummary;
import java.util.List;

/** One conversation of a grouped result with its best hits in fused order. */
public record ConversationGroup(
    ConversationSummary conversation, double bestScore, List<SearchHit> hits) {}
