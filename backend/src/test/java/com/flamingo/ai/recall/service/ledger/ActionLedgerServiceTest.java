package com.flamingo.ai.recall.service.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.recall.domain.entity.ActionEvent;
import com.flamingo.ai.recall.domain.enums.ActionStatus;
import com.flamingo.ai.recall.domain.repository.ActionEventRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ActionLedgerServiceTest {

  @Mock private ActionEventRepository actionEventRepository;

  @Captor private ArgumentCaptor<ActionEvent> eventCaptor;

  private ActionLedgerService ledger;

  @BeforeEach
  void setUp() {
    ledger = new ActionLedgerService(actionEventRepository, new ObjectMapper());
  }

  @Nested
  @DisplayName("recording")
  class Recording {

    @BeforeEach
    void stubSave() {
      when(actionEventRepository.save(any(ActionEvent.class)))
          .thenAnswer(
              invocation -> {
                ActionEvent event = invocation.getArgument(0);
                if (event.getId() == null) {
                  event.setId(42L);
                }
                return event;
              });
    }

    @Test
    @DisplayName("should record a running action with its parameters")
    void shouldRecordStart() {
      Map<String, Object> params = new LinkedHashMap<>();
      params.put("q", "sqlite");
      params.put("top", 5);

      ActionHandle handle = ledger.start("search", params);

      assertThat(handle.eventId()).isEqualTo(42L);
      verify(actionEventRepository).save(eventCaptor.capture());
      assertThat(eventCaptor.getValue().getStatus()).isEqualTo(ActionStatus.RUNNING);
      assertThat(eventCaptor.getValue().getParamsJson()).isEqualTo("{\"q\":\"sqlite\",\"top\":5}");
    }

    @Test
    @DisplayName("should complete the recorded action with counts and duration")
    void shouldRecordOutcome() {
      ActionHandle handle = ledger.start("search", Map.of("q", "sqlite"));
      ActionEvent event = eventCaptorValueAfterStart();
      when(actionEventRepository.findById(42L)).thenReturn(Optional.of(event));

      ledger.warn(handle, Map.of("merged", 3), "Semantic index timed out");

      verify(actionEventRepository, times(2)).save(eventCaptor.capture());
      ActionEvent finished = eventCaptor.getValue();
      assertThat(finished.getStatus()).isEqualTo(ActionStatus.WARN);
      assertThat(finished.getExtraJson()).isEqualTo("{\"merged\":3}");
      assertThat(finished.getError()).isEqualTo("Semantic index timed out");
      assertThat(finished.getFinishedAt()).isNotNull();
      assertThat(finished.getSeconds()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("should record the exception type on failure")
    void shouldRecordFailure() {
      ActionHandle handle = ledger.start("index.rebuild", Map.of());
      ActionEvent event = eventCaptorValueAfterStart();
      when(actionEventRepository.findById(42L)).thenReturn(Optional.of(event));

      ledger.fail(handle, new IllegalStateException("disk full"));

      verify(actionEventRepository, times(2)).save(eventCaptor.capture());
      assertThat(eventCaptor.getValue().getStatus()).isEqualTo(ActionStatus.ERROR);
      assertThat(eventCaptor.getValue().getError()).isEqualTo("IllegalStateException: disk full");
    }

    private ActionEvent eventCaptorValueAfterStart() {
      verify(actionEventRepository).save(eventCaptor.capture());
      return eventCaptor.getValue();
    }
  }

  @Test
  @DisplayName("should never fail the recorded operation when the ledger cannot be written")
  void shouldSwallowWriteFailures() {
    when(actionEventRepository.save(any(ActionEvent.class)))
        .thenThrow(new IllegalStateException("database is locked"));

    ActionHandle handle = ledger.start("search", Map.of("q", "x"));
    ledger.ok(handle, Map.of("merged", 0));

    assertThat(handle.eventId()).isNull();
    assertThat(handle.kind()).isEqualTo("search");
  }

  @Test
  @DisplayName("should list recent actions of one kind or of all kinds")
  void shouldListRecent() {
    ActionEvent event = ActionEvent.builder().id(1L).kind("search").build();
    when(actionEventRepository.findByKindOrderByIdDesc("search", PageRequest.of(0, 10)))
        .thenReturn(List.of(event));
    when(actionEventRepository.findAllByOrderByIdDesc(PageRequest.of(0, 1)))
        .thenReturn(List.of(event));

    assertThat(ledger.recent("search", 10)).containsExactly(event);
    assertThat(ledger.recent(" ", 0)).containsExactly(event);
  }
}
