package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.index.IndexStatus;
import com.flamingo.ai.recall.service.indexing.RebuildReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a full index rebuild. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebuildResponse {

  private int messages;
  private int embedded;
  private int staleEmbeddings;
  private double seconds;
  private List<String> failedIndexes;
  private List<IndexStatus> indexes;

  public static RebuildResponse fromReport(RebuildReport report) {
    return RebuildResponse.builder()
        .messages(report.messages())
        .embedded(report.embedded())
        .staleEmbeddings(report.staleEmbeddings())
        .seconds(Math.round(report.seconds() * 1000) / 1000.0)
        .failedIndexes(report.failedIndexes())
        .indexes(report.indexes())
        .build();
  }
}
