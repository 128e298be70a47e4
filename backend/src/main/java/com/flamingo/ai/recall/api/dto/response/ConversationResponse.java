package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.corpus.ConversationDetail;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation with its messages in chronological order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

  private ConversationSummaryResponse conversation;
  private List<MessageResponse> messages;

  public static ConversationResponse fromDetail(ConversationDetail detail) {
    return ConversationResponse.builder()
        .conversation(ConversationSummaryResponse.fromSummary(detail.summary()))
        .messages(detail.messages().stream().map(MessageResponse::fromEntity).toList())
        .build();
  }
}
