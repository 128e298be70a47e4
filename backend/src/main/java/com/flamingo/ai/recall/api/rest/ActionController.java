package com.flamingo.ai.recall.api.rest;

import com.flamingo.ai.recall.api.dto.response.ActionEventResponse;
import com.flamingo.ai.recall.service.ledger.ActionLedgerService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the action ledger. */
@RestController
@RequestMapping("/api/actions")
@RequiredArgsConstructor
public class ActionController {

  private static final int MAX_LIMIT = 500;

  private final ActionLedgerService actionLedgerService;

  /**
   * Lists recent actions, newest first.
   *
   * @param kind e.g. {@code search} or {@code index.rebuild}; all kinds when absent
   * @param limit maximum entries, capped at 500
   */
  @GetMapping
  public ResponseEntity<List<ActionEventResponse>> recent(
      @RequestParam(required = false) String kind,
      @RequestParam(defaultValue = "50") int limit) {
    List<ActionEventResponse> events =
        actionLedgerService.recent(kind, Math.min(limit, MAX_LIMIT)).stream()
            .map(ActionEventResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(events);
  }
}
