package com.flamingo.ai.recall.domain.entity;

import com.flamingo.ai.recall.domain.converter.InstantEpochSecondConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Stored attributes of an archived conversation.
 *
 * <p>Span, message count and project are derived from the messages on read.
 */
@Entity
@Table(name = "conversations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

  @Id private String id;

  private String title;

  /** Origin of the export, e.g. {@code chatgpt}. */
  private String source;

  @Convert(converter = InstantEpochSecondConverter.class)
  @Column(nullable = false, updatable = false)
  private Instant createdAt;
}
