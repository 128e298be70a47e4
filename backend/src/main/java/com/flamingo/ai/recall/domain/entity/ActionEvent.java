package com.flamingo.ai.recall.domain.entity;

import com.flamingo.ai.recall.domain.converter.InstantEpochSecondConverter;
import com.flamingo.ai.recall.domain.enums.ActionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One entry of the action ledger: a search, rebuild or backfill run. */
@Entity
@Table(
    name = "action_events",
    indexes = {@Index(name = "idx_action_events_kind", columnList = "kind")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String kind;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ActionStatus status;

  @Convert(converter = InstantEpochSecondConverter.class)
  @Column(nullable = false)
  private Instant startedAt;

  @Convert(converter = InstantEpochSecondConverter.class)
  private Instant finishedAt;

  private Double seconds;

  @Column(columnDefinition = "TEXT")
  private String paramsJson;

  @Column(columnDefinition = "TEXT")
  private String extraJson;

  @Column(columnDefinition = "TEXT")
  private String error;
}
