package com.flamingo.ai.recall.index;

import java.util.List;
import java.util.Map;

/**
 * Messages handed to the indexes for a build or an append, with the usable embeddings keyed by
 * message id. Messages without an entry in {@code embeddings} are lexical-only.
 */
public record CorpusSnapshot(List<IndexedMessage> messages, Map<String, float[]> embeddings) {

  public CorpusSnapshot {
    messages = List.copyOf(messages);
    embeddings = Map.copyOf(embeddings);
  }

  public static CorpusSnapshot empty() {
    return new CorpusSnapshot(List.of(), Map.of());
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}
