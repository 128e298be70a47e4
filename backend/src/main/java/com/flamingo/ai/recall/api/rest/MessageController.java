package com.flamingo.ai.recall.api.rest;

import com.flamingo.ai.recall.api.dto.response.MessageResponse;
import com.flamingo.ai.recall.service.recall.RecallService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for reading single messages. */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

  private final RecallService recallService;

  /** Gets a message with its full text. */
  @GetMapping("/{messageId}")
  public ResponseEntity<MessageResponse> getMessage(@PathVariable String messageId) {
    return ResponseEntity.ok(MessageResponse.fromEntity(recallService.getMessage(messageId)));
  }
}
