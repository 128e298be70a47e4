package com.flamingo.ai.recall.api.rest;

import com.flamingo.ai.recall.api.dto.request.IngestConversationRequest;
import com.flamingo.ai.recall.api.dto.response.ConversationResponse;
import com.flamingo.ai.recall.api.dto.response.IngestResponse;
import com.flamingo.ai.recall.service.corpus.CorpusService;
import com.flamingo.ai.recall.service.corpus.IngestResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingesting and reading conversations. */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class CorpusController {

  private final CorpusService corpusService;

  /**
   * Appends a conversation's messages to the archive.
   *
   * @param request the conversation and its messages
   * @return 201 when new messages were stored, 200 when every message was a redelivery
   */
  @PostMapping
  public ResponseEntity<IngestResponse> ingest(
      @Valid @RequestBody IngestConversationRequest request) {
    log.info(
        "Ingesting conversation {} with {} messages",
        request.getId(),
        request.getMessages().size());
    IngestResult result = corpusService.ingest(request.toIngest());
    HttpStatus status = result.accepted().isEmpty() ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status).body(IngestResponse.fromResult(result));
  }

  /**
   * Gets a conversation with all its messages.
   *
   * @param conversationId the conversation ID
   * @return the conversation summary and messages in chronological order
   */
  @GetMapping("/{conversationId}")
  public ResponseEntity<ConversationResponse> getConversation(
      @PathVariable String conversationId) {
    return ResponseEntity.ok(
        ConversationResponse.fromDetail(corpusService.getConversation(conversationId)));
  }
}
