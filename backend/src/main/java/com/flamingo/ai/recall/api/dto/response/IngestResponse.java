package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.corpus.IngestResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

  private String conversationId;
  private int acceptedCount;
  private int skippedCount;
  private List<String> accepted;
  private List<String> skipped;

  public static IngestResponse fromResult(IngestResult result) {
    return IngestResponse.builder()
        .conversationId(result.conversationId())
        .acceptedCount(result.accepted().size())
        .skippedCount(result.skipped().size())
        .accepted(result.accepted())
        .skipped(result.skipped())
        .build();
  }
}
