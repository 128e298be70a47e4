package com.flamingo.ai.recall.service.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.recall.domain.entity.ActionEvent;
import com.flamingo.ai.recall.domain.enums.ActionStatus;
import com.flamingo.ai.recall.domain.repository.ActionEventRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Records searches, index rebuilds and backfills with their parameters, outcome and duration.
 *
 * <p>A ledger write that fails is logged and dropped; it never fails the recorded operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionLedgerService {

  private final ActionEventRepository actionEventRepository;
  private final ObjectMapper objectMapper;

  /** Records the start of an action with status {@link ActionStatus#RUNNING}. */
  public ActionHandle start(String kind, Map<String, Object> params) {
    Instant now = Instant.now();
    Map<String, Object> copy = params == null ? Map.of() : new LinkedHashMap<>(params);
    Long eventId = null;
    try {
      ActionEvent event =
          actionEventRepository.save(
              ActionEvent.builder()
                  .kind(kind)
                  .status(ActionStatus.RUNNING)
                  .startedAt(now)
                  .paramsJson(toJson(copy))
                  .build());
      eventId = event.getId();
    } catch (RuntimeException e) {
      log.warn("Could not record start of {}: {}", kind, e.getMessage());
    }
    return new ActionHandle(eventId, kind, copy, now, System.nanoTime());
  }

  public void ok(ActionHandle handle, Map<String, Object> extra) {
    finish(handle, ActionStatus.OK, extra, null);
  }

  public void warn(ActionHandle handle, Map<String, Object> extra, String reason) {
    finish(handle, ActionStatus.WARN, extra, reason);
  }

  public void fail(ActionHandle handle, Throwable error) {
    finish(
        handle,
        ActionStatus.ERROR,
        Map.of(),
        error.getClass().getSimpleName() + ": " + error.getMessage());
  }

  /**
   * Records the end of an action.
   *
   * @param status final status, never {@link ActionStatus#RUNNING}
   * @param extra counts and other results
   * @param error failure or warning reason, may be null
   */
  public void finish(
      ActionHandle handle, ActionStatus status, Map<String, Object> extra, String error) {
    double seconds = round((System.nanoTime() - handle.startNanos()) / 1_000_000_000.0);
    try {
      ActionEvent event =
          handle.eventId() == null
              ? null
              : actionEventRepository.findById(handle.eventId()).orElse(null);
      if (event == null) {
        event =
            ActionEvent.builder()
                .kind(handle.kind())
                .startedAt(handle.startedAt())
                .paramsJson(toJson(handle.params()))
                .build();
      }
      event.setStatus(status);
      event.setFinishedAt(Instant.now());
      event.setSeconds(seconds);
      event.setExtraJson(toJson(extra));
      event.setError(error);
      actionEventRepository.save(event);
    } catch (RuntimeException e) {
      log.warn("Could not record end of {}: {}", handle.kind(), e.getMessage());
    }
  }

  /**
   * Lists recent actions, newest first.
   *
   * @param kind only actions of this kind, or all when null
   * @param limit maximum number of entries
   */
  public List<ActionEvent> recent(String kind, int limit) {
    PageRequest page = PageRequest.of(0, Math.max(1, limit));
    if (kind == null || kind.isBlank()) {
      return actionEventRepository.findAllByOrderByIdDesc(page);
    }
    return actionEventRepository.findByKindOrderByIdDesc(kind, page);
  }

  private String toJson(Map<String, Object> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      log.warn("Failed to serialize ledger values: {}", e.getMessage());
      return null;
    }
  }

  private static double round(double seconds) {
    return Math.round(seconds * 1000) / 1000.0;
  }
}
