package com.flamingo.ai.recall.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import com.flamingo.ai.recall.domain.enums.SearchMode;
import com.flamingo.ai.recall.exception.GlobalExceptionHandler;
import com.flamingo.ai.recall.exception.MessageNotFoundException;
import com.flamingo.ai.recall.exception.QueryValidationException;
import com.flamingo.ai.recall.search.SearchQuery;
import com.flamingo.ai.recall.search.SearchStatus;
import com.flamingo.ai.recall.service.corpus.ConversationSummary;
import com.flamingo.ai.recall.service.recall.ConversationGroup;
import com.flamingo.ai.recall.service.recall.GroupedSearchResult;
import com.flamingo.ai.recall.service.recall.RecallService;
import com.flamingo.ai.recall.service.recall.SearchCounts;
import com.flamingo.ai.recall.service.recall.SearchHit;
import com.flamingo.ai.recall.service.recall.SearchResult;
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
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SearchControllerTest {

  private static final Instant T1 = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private RecallService recallService;

  @Captor private ArgumentCaptor<SearchQuery> queryCaptor;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  private static SearchHit hit(String id, String conversationId) {
    return new SearchHit(
        id,
        conversationId,
        MessageRole.ASSISTANT,
        "recall",
        T1,
        "preview of " + id,
        1.5,
        null,
        0.75,
        List.of("lexical"));
  }

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SearchController(recallService), new MessageController(recallService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("should map query parameters and render flat hits")
  void shouldSearch() throws Exception {
    when(recallService.search(queryCaptor.capture()))
        .thenReturn(
            new SearchResult(
                SearchMode.HYBRID,
                SearchStatus.DEGRADED,
                List.of("Semantic index timed out"),
                new SearchCounts(1, 0, 1),
                0.012,
                List.of(hit("m1", "c1"))));

    mockMvc
        .perform(
            get("/api/search")
                .param("q", "sqlite fts")
                .param("project", "recall")
                .param("role", "assistant")
                .param("since", "2026-01-01")
                .param("top", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.mode").value("HYBRID"))
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.warnings[0]").value("Semantic index timed out"))
        .andExpect(jsonPath("$.counts.lexical").value(1))
        .andExpect(jsonPath("$.hits[0].messageId").value("m1"))
        .andExpect(jsonPath("$.hits[0].role").value("assistant"))
        .andExpect(jsonPath("$.hits[0].lexicalScore").value(1.5))
        .andExpect(jsonPath("$.hits[0].semanticScore").doesNotExist())
        .andExpect(jsonPath("$.hits[0].signals[0]").value("lexical"));

    SearchQuery query = queryCaptor.getValue();
    assertThat(query.terms()).isEqualTo("sqlite fts");
    assertThat(query.project()).isEqualTo("recall");
    assertThat(query.role()).isEqualTo("assistant");
    assertThat(query.since()).isEqualTo("2026-01-01");
    assertThat(query.topK()).isEqualTo(5);
    assertThat(query.group()).isFalse();
  }

  @Test
  @DisplayName("should route group=true to the grouped search")
  void shouldSearchGrouped() throws Exception {
    ConversationSummary summary =
        new ConversationSummary("c1", "Index tuning", "chatgpt", T1, T1, T1, 4, "recall");
    when(recallService.searchGrouped(queryCaptor.capture()))
        .thenReturn(
            new GroupedSearchResult(
                SearchMode.HYBRID,
                SearchStatus.OK,
                List.of(),
                new SearchCounts(2, 2, 2),
                0.02,
                List.of(new ConversationGroup(summary, 0.75, List.of(hit("m1", "c1"))))));

    mockMvc
        .perform(
            get("/api/search")
                .param("q", "index")
                .param("group", "true")
                .param("convos", "3")
                .param("perConvo", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("OK"))
        .andExpect(jsonPath("$.conversations[0].conversation.id").value("c1"))
        .andExpect(jsonPath("$.conversations[0].conversation.title").value("Index tuning"))
        .andExpect(jsonPath("$.conversations[0].bestScore").value(0.75))
        .andExpect(jsonPath("$.conversations[0].hits[0].messageId").value("m1"));

    assertThat(queryCaptor.getValue().group()).isTrue();
    assertThat(queryCaptor.getValue().convos()).isEqualTo(3);
    assertThat(queryCaptor.getValue().perConvo()).isEqualTo(2);
    verify(recallService, never()).search(any());
  }

  @Test
  @DisplayName("should answer 400 with the offending field for a malformed filter")
  void shouldRejectInvalidQuery() throws Exception {
    when(recallService.search(any()))
        .thenThrow(new QueryValidationException("since", "Unparseable since: 'yesterday'"));

    mockMvc
        .perform(get("/api/search").param("q", "x").param("since", "yesterday"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.details").value("since"))
        .andExpect(jsonPath("$.path").value("/api/search"));

    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "validation_error").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should answer 400 for a non-numeric limit")
  void shouldRejectNonNumericLimit() throws Exception {
    mockMvc
        .perform(get("/api/search").param("q", "x").param("top", "many"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details").value("top"));

    verify(recallService, never()).search(any());
  }

  @Test
  @DisplayName("should return a message with its full text")
  void shouldGetMessage() throws Exception {
    when(recallService.getMessage("m1"))
        .thenReturn(
            Message.builder()
                .id("m1")
                .conversationId("c1")
                .role(MessageRole.USER)
                .timestamp(T1)
                .text("the complete text")
                .build());

    mockMvc
        .perform(get("/api/messages/m1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("m1"))
        .andExpect(jsonPath("$.role").value("user"))
        .andExpect(jsonPath("$.text").value("the complete text"));
  }

  @Test
  @DisplayName("should answer 404 for an unknown message")
  void shouldReturnNotFoundForUnknownMessage() throws Exception {
    when(recallService.getMessage("nope")).thenThrow(new MessageNotFoundException("nope"));

    mockMvc
        .perform(get("/api/messages/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("MESSAGE_001"));
  }
}
