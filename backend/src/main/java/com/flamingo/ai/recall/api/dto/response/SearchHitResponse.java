package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.recall.SearchHit;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one search hit. Absent signals are null. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHitResponse {

  private String messageId;
  private String conversationId;
  private String role;
  private String project;
  private Instant timestamp;
  private String preview;
  private Double lexicalScore;
  private Double semanticScore;
  private double score;
  private List<String> signals;

  public static SearchHitResponse fromHit(SearchHit hit) {
    return SearchHitResponse.builder()
        .messageId(hit.messageId())
        .conversationId(hit.conversationId())
        .role(hit.role().wireName())
        .project(hit.project())
        .timestamp(hit.timestamp())
        .preview(hit.preview())
        .lexicalScore(hit.lexicalScore())
        .semanticScore(hit.semanticScore())
        .score(hit.score())
        .signals(hit.signals())
        .build();
  }
}
