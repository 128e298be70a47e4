package com.flamingo.ai.recall.index;

import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import java.time.Instant;

/** The fields of a message an index needs: filter attributes plus the text. */
public record IndexedMessage(
    String id,
    String conversationId,
    MessageRole role,
    String project,
    Instant timestamp,
    String text) {

  public static IndexedMessage fromEntity(Message message) {
    return new IndexedMessage(
        message.getId(),
        message.getConversationId(),
        message.getRole(),
        message.getProject(),
        message.getTimestamp(),
        message.getText());
  }
}
