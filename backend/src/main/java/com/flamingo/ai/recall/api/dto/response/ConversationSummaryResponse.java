package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.corpus.ConversationSummary;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for conversation metadata. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummaryResponse {

  private String id;
  private String title;
  private String source;
  private Instant createdAt;
  private Instant spanStart;
  private Instant spanEnd;
  private int messageCount;
  private String project;

  public static ConversationSummaryResponse fromSummary(ConversationSummary summary) {
    return ConversationSummaryResponse.builder()
        .id(summary.id())
        .title(summary.title())
        .source(summary.source())
        .createdAt(summary.createdAt())
        .spanStart(summary.spanStart())
        .spanEnd(summary.spanEnd())
        .messageCount(summary.messageCount())
        .project(summary.project())
        .build();
  }
}
