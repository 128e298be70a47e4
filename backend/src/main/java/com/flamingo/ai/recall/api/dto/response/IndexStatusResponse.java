package com.flamingo.ai.recall.api.dto.response;

import com.flamingo.ai.recall.index.IndexStatus;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the state of the indexes and of embedding coverage. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStatusResponse {

  private String backend;
  private long messages;
  private String embeddingModel;
  private long embeddings;
  private long missingEmbeddings;
  private List<IndexStatus> indexes;
}
