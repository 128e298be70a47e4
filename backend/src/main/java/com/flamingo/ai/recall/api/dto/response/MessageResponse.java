package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.domain.entity.Message;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

  private String id;
  private String conversationId;
  private String role;
  private String project;
  private Instant timestamp;
  private String text;

  /** Creates a MessageResponse from a Message entity. */
  public static MessageResponse fromEntity(Message message) {
    return MessageResponse.builder()
        .id(message.getId())
        .conversationId(message.getConversationId())
        .role(message.getRole().wireName())
        .project(message.getProject())
        .timestamp(message.getTimestamp())
        .text(message.getText())
        .build();
  }
}
