package com.flamingo.ai.recall.api.rest;

import com.flamingo.ai.recall.api.dto.response.GroupedSearchResponse;
import com.flamingo.ai.recall.api.dto.response.SearchResponse;
import com.flamingo.ai.recall.search.SearchQuery;
import com.flamingo.ai.recall.service.recall.RecallService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching the archive. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final RecallService recallService;

  /**
   * Searches messages. Without {@code q} the matching messages are listed newest first.
   *
   * @param q free-text terms
   * @param project exact project filter
   * @param role user, assistant, system or other
   * @param since inclusive lower bound: unix seconds, YYYY-MM-DD or ISO-8601
   * @param until inclusive upper bound, same formats as {@code since}
   * @param top maximum number of hits
   * @return ranked hits with the search status
   */
  @GetMapping
  public ResponseEntity<SearchResponse> search(
      @RequestParam(required = false) String q,
      @RequestParam(required = false) String project,
      @RequestParam(required = false) String role,
      @RequestParam(required = false) String since,
      @RequestParam(required = false) String until,
      @RequestParam(required = false) Integer top) {
    SearchQuery query =
        SearchQuery.builder()
            .terms(q)
            .project(project)
            .role(role)
            .since(since)
            .until(until)
            .topK(top)
            .build();
    return ResponseEntity.ok(SearchResponse.fromResult(recallService.search(query)));
  }

  /**
   * Searches messages and groups the hits by conversation.
   *
   * @param convos maximum number of conversations
   * @param perConvo maximum hits per conversation
   * @return conversations ordered by their best hit
   */
  @GetMapping(params = "group=true")
  public ResponseEntity<GroupedSearchResponse> searchGrouped(
      @RequestParam(required = false) String q,
      @RequestParam(required = false) String project,
      @RequestParam(required = false) String role,
      @RequestParam(required = false) String since,
      @RequestParam(required = false) String until,
      @RequestParam(required = false) Integer top,
      @RequestParam(required = false) Integer convos,
      @RequestParam(required = false) Integer perConvo) {
    SearchQuery query =
        SearchQuery.builder()
            .terms(q)
            .project(project)
            .role(role)
            .since(since)
            .until(until)
            .topK(top)
            .group(true)
            .convos(convos)
            .perConvo(perConvo)
            .build();
    return ResponseEntity.ok(GroupedSearchResponse.fromResult(recallService.searchGrouped(query)));
  }
}
