package com.flamingo.ai.recall.index.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message as stored in an Elasticsearch generation index.
 *
 * <p>Search requests exclude {@code text} and {@code embedding} from the returned source, so both
 * are null on documents read back from a hit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageDocument {

  private String conversationId;

  /** Wire name of the message role. */
  private String role;

  /** Null when the message belongs to no project. */
  private String project;

  /** Message timestamp (epoch seconds). */
  private Long timestamp;

  private String text;

  /** Absent when the message has no usable embedding. */
  private List<Float> embedding;
}
