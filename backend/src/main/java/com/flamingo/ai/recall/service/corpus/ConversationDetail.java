package com.flamingo.ai.recall.service.corpus;

import com.flamingo.ai.recall.domain.entity.Message;
import java.util.List;

/** A conversation with all its messages in chronological order. */
public record ConversationDetail(ConversationSummary summary, List<Message> messages) {}
