package com.flamingo.ai.recall.domain.entity;

import com.flamingo.ai.recall.domain.converter.InstantEpochSecondConverter;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A single archived message, the unit every index retrieves. Immutable once stored. */
@Entity
@Table(
    name = "messages",
    indexes = {
      @Index(name = "idx_messages_conversation", columnList = "conversationId"),
      @Index(name = "idx_messages_timestamp", columnList = "timestamp")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

  /** Identifier supplied by the ingesting connector. */
  @Id private String id;

  @Column(nullable = false, updatable = false)
  private String conversationId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false)
  private MessageRole role;

  private String project;

  /** Authoring time, second precision. */
  @Convert(converter = InstantEpochSecondConverter.class)
  @Column(nullable = false, updatable = false)
  private Instant timestamp;

  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String text;
}
