package com.flamingo.ai.recall.api.dto.response;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flamingo.ai.recall.domain.entity.ActionEvent;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an action ledger entry. Params and extra are embedded as JSON objects. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionEventResponse {

  private Long id;
  private String kind;
  private String status;
  private Instant startedAt;
  private Instant finishedAt;
  private Double seconds;

  @JsonRawValue private String params;

  @JsonRawValue private String extra;

  private String error;

  public static ActionEventResponse fromEntity(ActionEvent event) {
    return ActionEventResponse.builder()
        .id(event.getId())
        .kind(event.getKind())
        .status(event.getStatus().name())
        .startedAt(event.getStartedAt())
        .finishedAt(event.getFinishedAt())
        .seconds(event.getSeconds())
        .params(event.getParamsJson())
        .extra(event.getExtraJson())
        .error(event.getError())
        .build();
  }
}
