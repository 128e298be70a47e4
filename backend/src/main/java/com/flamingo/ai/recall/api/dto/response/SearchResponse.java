package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.recall.SearchCounts;
import com.flamingo.ai.recall.service.recall.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a flat search.
 *
 * <p>{@code status} distinguishes "no matches" ({@code OK} with no hits) from "could not search"
 * ({@code UNAVAILABLE}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private String mode;
  private String status;
  private List<String> warnings;
  private SearchCounts counts;
  private double seconds;
  private List<SearchHitResponse> hits;

  public static SearchResponse fromResult(SearchResult result) {
    return SearchResponse.builder()
        .mode(result.mode().name())
        .status(result.status().name())
        .warnings(result.warnings())
        .counts(result.counts())
        .seconds(result.seconds())
        .hits(result.hits().stream().map(SearchHitResponse::fromHit).toList())
        .build();
  }
}
