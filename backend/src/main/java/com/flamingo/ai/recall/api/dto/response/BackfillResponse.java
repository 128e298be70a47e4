package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.embedding.BackfillReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an embedding backfill run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResponse {

  private String model;
  private int candidates;
  private int embedded;
  private int failed;
  private long remaining;
  private boolean aborted;

  public static BackfillResponse fromReport(BackfillReport report) {
    return BackfillResponse.builder()
        .model(report.model())
        .candidates(report.candidates())
        .embedded(report.embedded())
        .failed(report.failed())
        .remaining(report.remaining())
        .aborted(report.aborted())
        .build();
  }
}
