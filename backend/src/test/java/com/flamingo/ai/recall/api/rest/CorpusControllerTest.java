package com.flamingo.ai.recall.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.recall.exception.ConversationNotFoundException;
import com.flamingo.ai.recall.exception.DuplicateMessageException;
import com.flamingo.ai.recall.exception.GlobalExceptionHandler;
import com.flamingo.ai.recall.service.corpus.ConversationIngest;
import com.flamingo.ai.recall.service.corpus.CorpusService;
import com.flamingo.ai.recall.service.corpus.IngestResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CorpusControllerTest {

  private static final String BODY =
      """
      {
        "id": "c1",
        "title": "Index tuning",
        "source": "chatgpt",
        "messages": [
          {"id": "m1", "role": "user", "timestamp": "2026-03-01T10:00:00Z",
           "text": "How do I tune bm25?"},
          {"id": "m2", "role": "tool", "project": "recall",
           "timestamp": "2026-03-01T10:00:30Z", "text": "k1=1.2"}
        ]
      }
      """;

  @Mock private CorpusService corpusService;

  @Captor private ArgumentCaptor<ConversationIngest> ingestCaptor;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new CorpusController(corpusService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("should answer 201 when new messages were stored")
  void shouldIngestConversation() throws Exception {
    when(corpusService.ingest(ingestCaptor.capture()))
        .thenReturn(new IngestResult("c1", List.of("m1", "m2"), List.of()));

    mockMvc
        .perform(post("/api/conversations").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.conversationId").value("c1"))
        .andExpect(jsonPath("$.acceptedCount").value(2))
        .andExpect(jsonPath("$.skippedCount").value(0));

    ConversationIngest ingest = ingestCaptor.getValue();
    assertThat(ingest.id()).isEqualTo("c1");
    assertThat(ingest.messages()).hasSize(2);
    assertThat(ingest.messages().get(1).role()).isEqualTo("tool");
    assertThat(ingest.messages().get(1).timestamp())
        .isEqualTo(Instant.parse("2026-03-01T10:00:30Z"));
  }

  @Test
  @DisplayName("should answer 200 when every message was a redelivery")
  void shouldAcceptRedelivery() throws Exception {
    when(corpusService.ingest(any()))
        .thenReturn(new IngestResult("c1", List.of(), List.of("m1", "m2")));

    mockMvc
        .perform(post("/api/conversations").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.skipped[1]").value("m2"));
  }

  @Test
  @DisplayName("should answer 409 when a stored message arrives with different text")
  void shouldRejectConflictingRedelivery() throws Exception {
    when(corpusService.ingest(any())).thenThrow(new DuplicateMessageException("m1"));

    mockMvc
        .perform(post("/api/conversations").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CORPUS_001"))
        .andExpect(jsonPath("$.details").value("m1"));
  }

  @Test
  @DisplayName("should answer 400 for a message without a timestamp")
  void shouldRejectInvalidBody() throws Exception {
    String body =
        """
        {"id": "c1", "messages": [{"id": "m1", "role": "user", "text": "hi"}]}
        """;

    mockMvc
        .perform(post("/api/conversations").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(corpusService, never()).ingest(any());
  }

  @Test
  @DisplayName("should answer 404 for an unknown conversation")
  void shouldReturnNotFoundForUnknownConversation() throws Exception {
    when(corpusService.getConversation("nope"))
        .thenThrow(new ConversationNotFoundException("nope"));

    mockMvc
        .perform(get("/api/conversations/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CONVERSATION_001"));
  }
}
