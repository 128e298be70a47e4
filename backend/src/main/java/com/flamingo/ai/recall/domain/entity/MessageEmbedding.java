package com.flamingo.ai.recall.domain.entity;

import com.flamingo.ai.recall.domain.converter.FloatVectorConverter;
import com.flamingo.ai.recall.domain.converter.InstantEpochSecondConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Embedding vector of one message, with the model and text hash it was computed from. */
@Entity
@Table(name = "message_embeddings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageEmbedding {

  @Id private String messageId;

  @Column(nullable = false)
  private String model;

  @Column(nullable = false)
  private int dimensions;

  @Convert(converter = FloatVectorConverter.class)
  @Column(nullable = false)
  private float[] vector;

  /** SHA-256 hex of the embedded text; builds ignore the vector when it no longer matches. */
  @Column(nullable = false, length = 64)
  private String contentHash;

  @Convert(converter = InstantEpochSecondConverter.class)
  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
