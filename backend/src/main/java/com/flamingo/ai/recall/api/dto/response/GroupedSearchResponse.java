package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.service.recall.ConversationGroup;
import com.flamingo.ai.recall.service.recall.GroupedSearchResult;
import com.flamingo.ai.recall.service.recall.SearchCounts;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search grouped by conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupedSearchResponse {

  private String mode;
  private String status;
  private List<String> warnings;
  private SearchCounts counts;
  private double seconds;
  private List<Group> conversations;

  /** One conversation and its hits. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Group {
    private ConversationSummaryResponse conversation;
    private double bestScore;
    private List<SearchHitResponse> hits;

    static Group fromGroup(ConversationGroup group) {
      return Group.builder()
          .conversation(ConversationSummaryResponse.fromSummary(group.conversation()))
          .bestScore(group.bestScore())
          .hits(group.hits().stream().map(SearchHitResponse::fromHit).toList())
          .build();
    }
  }

  public static GroupedSearchResponse fromResult(GroupedSearchResult result) {
    return GroupedSearchResponse.builder()
        .mode(result.mode().name())
        .status(result.status().name())
        .warnings(result.warnings())
        .counts(result.counts())
        .seconds(result.seconds())
        .conversations(result.groups().stream().map(Group::fromGroup).toList())
        .build();
  }
}
