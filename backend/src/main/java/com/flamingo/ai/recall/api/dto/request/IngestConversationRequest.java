package com.flamingo.ai.recall.api.dto.request;

import com.flamingo.ai.recall.service.corpus.ConversationIngest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for delivering a conversation and its messages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestConversationRequest {

  @NotBlank(message = "Conversation id is required")
  @Size(max = 255, message = "Conversation id must not exceed 255 characters")
  private String id;

  private String title;

  private String source;

  private Instant createdAt;

  @NotEmpty(message = "At least one message is required")
  @Valid
  private List<MessagePayload> messages;

  /** One delivered message. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class MessagePayload {

    @NotBlank(message = "Message id is required")
    @Size(max = 255, message = "Message id must not exceed 255 characters")
    private String id;

    @NotBlank(message = "Role is required")
    private String role;

    private String project;

    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    @NotNull(message = "Text is required")
    private String text;
  }

  /** Converts this request into the corpus ingestion form. */
  public ConversationIngest toIngest() {
    return new ConversationIngest(
        id,
        title,
        source,
        createdAt,
        messages.stream()
            .map(
                m ->
                    new ConversationIngest.MessageIngest(
                        m.getId(), m.getRole(), m.getProject(), m.getTimestamp(), m.getText()))
            .toList());
  }
}
